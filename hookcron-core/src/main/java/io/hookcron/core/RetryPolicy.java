package io.hookcron.core;

import java.util.Set;

/**
 * Automatic retry settings of a job.
 *
 * @param enabled           retries are attempted only when true
 * @param maxAttempts       total attempts allowed, the first one included
 * @param retryableStatuses HTTP statuses that qualify for a retry; transport errors always qualify
 */
public record RetryPolicy(boolean enabled, int maxAttempts, Set<Integer> retryableStatuses) {

    public RetryPolicy {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative");
        }
        retryableStatuses = retryableStatuses == null ? Set.of() : Set.copyOf(retryableStatuses);
    }

    public static RetryPolicy disabled() {
        return new RetryPolicy(false, 0, Set.of());
    }

    /**
     * Whether a failed attempt may be retried.
     *
     * @param attemptCount attempts made so far, the failed one included
     */
    public boolean allowsRetry(int attemptCount, DispatchResult result) {
        if (!enabled || attemptCount >= maxAttempts) {
            return false;
        }
        return result.transportFailure() || retryableStatuses.contains(result.status());
    }
}
