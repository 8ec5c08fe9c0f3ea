package com.universe.manager.commandcenter.fetch;

import java.time.Duration;

/**
 * Bounded exponential backoff without jitter.
 *
 * A logical fetch makes at most {@code 1 + maxRetryAttempts} attempts. The delay
 * before retry {@code n} (0-based) is {@code baseRetryDelay * 2^n}.
 */
public record RetryPolicy(int maxRetryAttempts, Duration baseRetryDelay) {

    public static final int MAX_RETRY_ATTEMPTS = 3;
    public static final long BASE_RETRY_DELAY_MS = 1000;

    public RetryPolicy {
        if (maxRetryAttempts < 0) {
            throw new IllegalArgumentException("maxRetryAttempts must be >= 0, got " + maxRetryAttempts);
        }
        if (baseRetryDelay == null || baseRetryDelay.isNegative()) {
            throw new IllegalArgumentException("baseRetryDelay must be >= 0, got " + baseRetryDelay);
        }
        // 2^30 * base already overflows any sane delay
        if (maxRetryAttempts > 30) {
            throw new IllegalArgumentException("maxRetryAttempts must be <= 30, got " + maxRetryAttempts);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(MAX_RETRY_ATTEMPTS, Duration.ofMillis(BASE_RETRY_DELAY_MS));
    }

    /**
     * @param retriesSoFar retries already performed for the current fetch
     * @return delay to wait before the next attempt
     */
    public Duration delayBeforeRetry(int retriesSoFar) {
        return baseRetryDelay.multipliedBy(1L << retriesSoFar);
    }

    public int maxAttempts() {
        return maxRetryAttempts + 1;
    }
}
