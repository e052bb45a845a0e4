package com.ivamare.workflow.retry;

import java.time.Duration;

/**
 * Exponential backoff for transient work failures.
 *
 * <p>The n-th retry (0-based count of earlier failures) waits
 * {@code baseDelay * multiplier^n}. With the defaults that is 5, 10 and 20 minutes,
 * and the fourth failure is dead-lettered.
 *
 * @param maxRetries Retries allowed before dead-lettering
 * @param baseDelay Delay before the first retry
 * @param multiplier Growth factor per retry
 */
public record BackoffPolicy(
    int maxRetries,
    Duration baseDelay,
    double multiplier
) {
    public BackoffPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be a non-negative duration");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
    }

    /**
     * Default policy: 3 retries, 5 minute base delay, doubling.
     *
     * @return Default backoff policy
     */
    public static BackoffPolicy defaultPolicy() {
        return new BackoffPolicy(3, Duration.ofMinutes(5), 2.0);
    }

    /**
     * Policy that dead-letters on the first failure.
     *
     * @return No retry policy
     */
    public static BackoffPolicy noRetry() {
        return new BackoffPolicy(0, Duration.ofMinutes(5), 2.0);
    }

    /**
     * Delay before the next attempt.
     *
     * @param retryCount Number of failures before this one
     * @return Delay until the item may be claimed again
     */
    public Duration delayFor(int retryCount) {
        double factor = Math.pow(multiplier, Math.max(retryCount, 0));
        return Duration.ofMillis(Math.round(baseDelay.toMillis() * factor));
    }

    /**
     * Check if another retry is allowed.
     *
     * @param retryCount Number of failures before this one
     * @param itemMaxRetries Retry budget of the item
     * @return true if the failure should be retried
     */
    public boolean shouldRetry(int retryCount, int itemMaxRetries) {
        return retryCount < itemMaxRetries;
    }
}
