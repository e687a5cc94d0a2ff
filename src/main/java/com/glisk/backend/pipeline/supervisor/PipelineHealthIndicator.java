package com.glisk.backend.pipeline.supervisor;

import com.glisk.backend.pipeline.config.PipelineProperties;
import com.glisk.backend.token.model.TokenStatus;
import com.glisk.backend.token.repo.TokenRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * /actuator/health "pipeline": worker loop liveness plus token counts per status.
 * Repeated reveal failures show up here as a growing READY count, never as FAILED tokens.
 */
@RequiredArgsConstructor
@Component("pipeline")
public class PipelineHealthIndicator implements HealthIndicator {

    private final WorkerSupervisor supervisor;
    private final PipelineProperties props;
    private final TokenRepository tokenRepo;

    @Override
    public Health health() {
        Map<String, Object> counts = new LinkedHashMap<>();
        for (TokenStatus s : TokenStatus.values()) {
            counts.put(s.name().toLowerCase(Locale.ROOT), tokenRepo.countByStatus(s));
        }

        Health.Builder b;
        if (!props.isEnabled()) {
            b = Health.up().withDetail("enabled", false);
        } else {
            boolean allAlive = !supervisor.states().isEmpty()
                    && supervisor.states().stream().allMatch(WorkerState::running);
            b = allAlive ? Health.up() : Health.down();
        }
        return b.withDetail("workers", supervisor.states())
                .withDetail("tokens", counts)
                .build();
    }
}
