package com.glisk.backend.pipeline.retry;

import com.glisk.backend.common.error.TransientServiceException;
import com.glisk.backend.pipeline.config.RetryProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Backoff and attempt accounting shared by the generation and upload workers.
 * attempts is the count after the current attempt was recorded (1 for the first call).
 */
@RequiredArgsConstructor
@Component
public class RetryPolicy {

    private final RetryProperties props;

    /** base * 2^(attempts-1), capped at max-delay */
    public Duration nextDelay(int attempts) {
        long baseMs = Math.max(0, props.getBaseDelay().toMillis());
        long maxMs = Math.max(baseMs, props.getMaxDelay().toMillis());
        int exp = Math.max(0, Math.min(attempts - 1, 30));
        long delay = baseMs << exp;
        if (delay < 0 || delay > maxMs) delay = maxMs;
        return Duration.ofMillis(delay);
    }

    /** a server Retry-After hint wins when it is longer than our own backoff */
    public Duration nextDelay(int attempts, TransientServiceException e) {
        Duration d = nextDelay(attempts);
        Integer hint = e == null ? null : e.retryAfterSec();
        if (hint != null && Duration.ofSeconds(hint).compareTo(d) > 0) {
            return Duration.ofSeconds(hint);
        }
        return d;
    }

    public Instant nextAttemptAt(Instant now, int attempts, TransientServiceException e) {
        return now.plus(nextDelay(attempts, e));
    }

    public boolean shouldGiveUp(int attempts, int maxAttempts) {
        return attempts >= maxAttempts;
    }
}
