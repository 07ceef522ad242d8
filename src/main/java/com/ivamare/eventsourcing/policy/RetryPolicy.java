package com.ivamare.eventsourcing.policy;

import java.time.Duration;

/**
 * Policy for re-invoking a failed command pipeline.
 *
 * @param maxAttempts total attempts including the first one
 * @param delay       base delay; attempt {@code n} waits {@code n * delay}
 */
public record RetryPolicy(
    int maxAttempts,
    Duration delay
) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        delay = delay == null ? Duration.ZERO : delay;
    }

    /**
     * Default retry policy: 3 attempts, 1 second base delay.
     *
     * @return Default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(3, Duration.ofSeconds(1));
    }

    /**
     * Create a policy with no retries.
     *
     * @return No retry policy
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO);
    }

    /**
     * Get the backoff before the next attempt. Grows linearly with the attempt number.
     *
     * @param attempt the attempt that just failed (1-based)
     * @return delay before the next attempt, zero when no attempts remain
     */
    public Duration getBackoff(int attempt) {
        if (!shouldRetry(attempt)) {
            return Duration.ZERO;
        }
        return delay.multipliedBy(Math.max(attempt, 1));
    }

    /**
     * Check if another retry should be attempted.
     *
     * @param attempt The current attempt number (1-based)
     * @return true if more attempts are allowed
     */
    public boolean shouldRetry(int attempt) {
        return attempt < maxAttempts;
    }
}
