package org.retrier.backoff;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Pauses for the same period of time before every attempt.
 */
@Value
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FixedBackoffPolicy implements BackoffPolicy {

    long period;

    public static FixedBackoffPolicy of(long period) {
        if (period < 0) {
            throw new IllegalArgumentException("Backoff period must be non-negative");
        }

        return new FixedBackoffPolicy(period);
    }

    @Override
    public long computeDelay(int attempt) {
        return period;
    }
}
