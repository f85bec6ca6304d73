package org.retrier.backoff;

/**
 * Computes the pause before the next attempt of a retried operation.
 * <p>
 * Implementations must be pure: the result depends only on the given attempt and the policy's own
 * configuration, and is never negative.
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * Returns delay in milliseconds to wait after the given failed attempt.
     *
     * @param attempt 1-indexed number of attempts made so far
     */
    long computeDelay(int attempt);
}
