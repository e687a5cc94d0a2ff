package com.glisk.backend.token.claim;

import com.glisk.backend.token.repo.TokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Returns work a dead worker left behind. A {@code generating} token with an expired lease goes
 * back to {@code detected}; other statuses just lose the stale lease.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class ClaimReaper {

    private final TokenRepository tokenRepo;
    private final Clock clock;

    @Scheduled(fixedDelay = 30_000)
    @Transactional
    public void reap() {
        Instant now = clock.instant();

        int orphaned = tokenRepo.resetOrphanedGenerating(now);
        int cleared = tokenRepo.clearExpiredClaims(now);

        if (orphaned > 0 || cleared > 0) {
            log.warn("claim.reaped orphanedGenerating={} expiredClaims={}", orphaned, cleared);
        }
    }
}
