package com.glisk.backend.pipeline.retry;

import com.glisk.backend.common.error.TransientServiceException;
import com.glisk.backend.pipeline.config.RetryProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(new RetryProperties());

    @Test
    void delay_doubles_per_attempt() {
        assertThat(policy.nextDelay(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.nextDelay(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.nextDelay(3)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    void delay_is_capped() {
        assertThat(policy.nextDelay(10)).isEqualTo(Duration.ofSeconds(60));
        assertThat(policy.nextDelay(500)).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void longer_retry_after_hint_wins() {
        TransientServiceException rateLimited = new TransientServiceException("STORAGE_RATE_LIMITED", "slow down", 30, null);
        TransientServiceException shortHint = new TransientServiceException("STORAGE_UPSTREAM_5XX", "503", 1, null);

        assertThat(policy.nextDelay(1, rateLimited)).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.nextDelay(3, shortHint)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    void nextAttemptAt_adds_delay_to_now() {
        Instant now = Instant.parse("2025-01-01T00:00:00Z");

        assertThat(policy.nextAttemptAt(now, 2, new TransientServiceException("X", "y")))
                .isEqualTo(now.plusSeconds(2));
    }

    @Test
    void gives_up_when_attempts_reach_max() {
        assertThat(policy.shouldGiveUp(2, 3)).isFalse();
        assertThat(policy.shouldGiveUp(3, 3)).isTrue();
        assertThat(policy.shouldGiveUp(4, 3)).isTrue();
    }
}
