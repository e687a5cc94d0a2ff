package com.glisk.backend.common.util;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Blocking retry with exponential backoff (initial, 2x, 4x ...), for calls that have no
 * claim or persisted attempt counter behind them (RPC reads).
 */
@Slf4j
public final class RetryUtils {

    private static final double BACKOFF_MULTIPLIER = 2.0;

    private RetryUtils() {}

    /**
     * Runs {@code task} up to {@code maxAttempts} times. Exceptions for which {@code retryable}
     * is false are thrown at once; otherwise the last one is thrown after the final attempt.
     */
    public static <T> T executeWithRetry(String op,
                                         RetryableTask<T> task,
                                         int maxAttempts,
                                         Duration initialDelay,
                                         Predicate<Exception> retryable) throws Exception {
        long delayMs = initialDelay.toMillis();
        Exception last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return task.execute();
            } catch (Exception e) {
                last = e;
                if (!retryable.test(e)) throw e;
                if (attempt < maxAttempts) {
                    log.warn("retry op={} attempt={} waitMs={} error={}", op, attempt, delayMs, e.getMessage());
                    Thread.sleep(delayMs);
                    delayMs = (long) (delayMs * BACKOFF_MULTIPLIER);
                } else {
                    log.error("retry.exhausted op={} attempts={} error={}", op, maxAttempts, e.getMessage());
                }
            }
        }
        throw last;
    }

    @FunctionalInterface
    public interface RetryableTask<T> {
        T execute() throws Exception;
    }
}
