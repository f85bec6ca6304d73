package org.retrier.backoff;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Grows the pause by {@code factor} after each attempt, starting at {@code initDelay} and never exceeding
 * {@code maxDelay}.
 */
@Value
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExponentialBackoffPolicy implements BackoffPolicy {

    long initDelay;

    long maxDelay;

    double factor;

    public static ExponentialBackoffPolicy of(long initDelay, long maxDelay, double factor) {
        if (initDelay < 0 || maxDelay < 0) {
            throw new IllegalArgumentException("Backoff delays must be non-negative");
        }
        if (!(factor >= 1)) {
            throw new IllegalArgumentException("Backoff factor must be greater than or equal to 1");
        }

        return new ExponentialBackoffPolicy(initDelay, maxDelay, factor);
    }

    /**
     * Computed in floating point so that a huge attempt saturates instead of overflowing before the clamp.
     * The fractional part of a millisecond is discarded.
     */
    @Override
    public long computeDelay(int attempt) {
        return (long) Math.min(Math.pow(factor, attempt - 1) * initDelay, maxDelay);
    }
}
