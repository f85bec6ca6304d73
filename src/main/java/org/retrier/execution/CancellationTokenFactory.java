package org.retrier.execution;

import io.vertx.core.Vertx;
import org.retrier.log.Logger;
import org.retrier.log.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Creates {@link CancellationToken}s, optionally cancelled automatically once a timeout expires.
 */
public class CancellationTokenFactory {

    private static final Logger logger = LoggerFactory.getLogger(CancellationTokenFactory.class);

    private final Vertx vertx;
    private final Clock clock;

    public CancellationTokenFactory(Vertx vertx, Clock clock) {
        this.vertx = Objects.requireNonNull(vertx);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Returns a {@link CancellationToken} without deadline.
     */
    public CancellationToken create() {
        return new CancellationToken(clock, CancellationToken.NO_DEADLINE);
    }

    /**
     * Returns a {@link CancellationToken} cancelled with {@link TimeoutException} after specified amount of
     * milliseconds starting from the provided instant.
     */
    public CancellationToken create(long startTime, long timeout) {
        if (startTime < 1 || timeout < 1) {
            throw new IllegalArgumentException("Start time and timeout must be positive");
        }

        final CancellationToken token = new CancellationToken(clock, startTime + timeout);
        final long remaining = token.remaining();
        if (remaining < 1) {
            token.cancel(timeoutException(timeout));
            return token;
        }

        final long timerId = vertx.setTimer(remaining, ignored -> {
            if (token.cancel(timeoutException(timeout))) {
                logger.debug("Cancellation token expired after {} ms", timeout);
            }
        });
        token.onCancel(ignored -> vertx.cancelTimer(timerId));

        return token;
    }

    /**
     * Returns a {@link CancellationToken} cancelled with {@link TimeoutException} after specified amount of
     * milliseconds starting from the current moment.
     */
    public CancellationToken create(long timeout) {
        return create(clock.millis(), timeout);
    }

    private static TimeoutException timeoutException(long timeout) {
        return new TimeoutException(String.format("Timeout has been exceeded: %d ms", timeout));
    }
}
