package org.retrier.execution;

import io.vertx.core.Handler;
import org.retrier.exception.ExecutionCancelledException;

import java.time.Clock;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * External signal that aborts a {@link Retrier} execution. Raised by the caller, or by a deadline when created
 * with {@link CancellationTokenFactory}.
 */
public class CancellationToken {

    static final long NO_DEADLINE = Long.MAX_VALUE;

    private final Clock clock;
    private final long deadline;

    private final AtomicReference<Throwable> cause = new AtomicReference<>();
    // each registration is its own entry, so the same handler may be registered more than once
    private final Set<CancelHandler> cancelHandlers = ConcurrentHashMap.newKeySet();

    CancellationToken(Clock clock, long deadline) {
        this.clock = Objects.requireNonNull(clock);
        this.deadline = deadline;
    }

    /**
     * Returns token which is cancelled by caller only.
     */
    public static CancellationToken create() {
        return new CancellationToken(Clock.systemUTC(), NO_DEADLINE);
    }

    public boolean isCancelled() {
        return cause.get() != null;
    }

    /**
     * Returns the error this token was cancelled with, or null while it is not cancelled.
     */
    public Throwable cause() {
        return cause.get();
    }

    public boolean cancel() {
        return cancel(new ExecutionCancelledException("Execution has been cancelled"));
    }

    /**
     * Cancels this token with the given cause. Only the first cancellation takes effect.
     *
     * @return true if this call cancelled the token
     */
    public boolean cancel(Throwable cause) {
        Objects.requireNonNull(cause);
        if (!this.cause.compareAndSet(null, cause)) {
            return false;
        }

        for (CancelHandler cancelHandler : cancelHandlers) {
            if (cancelHandlers.remove(cancelHandler)) {
                cancelHandler.handler.handle(cause);
            }
        }
        return true;
    }

    /**
     * Registers a {@link Handler} called with the cancellation cause once this token is cancelled, or
     * right away if it already is.
     */
    public Registration onCancel(Handler<Throwable> handler) {
        Objects.requireNonNull(handler);

        final CancelHandler cancelHandler = new CancelHandler(handler);
        cancelHandlers.add(cancelHandler);
        // cancel() may have run between the add and this check
        final Throwable currentCause = cause.get();
        if (currentCause != null && cancelHandlers.remove(cancelHandler)) {
            handler.handle(currentCause);
        }

        return () -> cancelHandlers.remove(cancelHandler);
    }

    /**
     * Returns amount of milliseconds remaining before the deadline of this token, {@link Long#MAX_VALUE} if it has
     * none.
     */
    public long remaining() {
        return deadline == NO_DEADLINE ? NO_DEADLINE : Math.max(deadline - clock.millis(), 0);
    }

    private static final class CancelHandler {

        private final Handler<Throwable> handler;

        private CancelHandler(Handler<Throwable> handler) {
            this.handler = handler;
        }
    }

    @FunctionalInterface
    public interface Registration {

        void unregister();
    }
}
