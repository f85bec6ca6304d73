package org.retrier.execution;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.apache.commons.lang3.Validate;
import org.retrier.backoff.BackoffPolicy;
import org.retrier.backoff.ExponentialBackoffPolicy;
import org.retrier.backoff.FixedBackoffPolicy;
import org.retrier.log.Logger;
import org.retrier.log.LoggerFactory;

import java.util.Objects;

/**
 * Keeps executing an operation, with a {@link BackoffPolicy} driven pause between attempts, until one of the
 * following happens:
 * <ul>
 * <li>the operation succeeds;</li>
 * <li>the number of retries is exceeded, failing with the last error of the operation;</li>
 * <li>the {@link CancellationToken} is cancelled, failing with its cause.</li>
 * </ul>
 * <p>
 * Configuration may be changed between executions. Executions in progress read it without synchronization,
 * so reconfiguring while one is running is up to the caller.
 */
public class Retrier {

    private static final Logger logger = LoggerFactory.getLogger(Retrier.class);

    private static final long DEFAULT_BACKOFF_PERIOD = 1000L;

    private final Vertx vertx;
    private final RetryFailureHandler failureHandler;

    private volatile int retries;
    private volatile boolean unlimited;
    private volatile BackoffPolicy backoffPolicy;

    /**
     * @param retries        number of retries attempted before giving up, negative to retry forever
     * @param failureHandler notified about each failed attempt, may be null
     */
    public Retrier(Vertx vertx, int retries, RetryFailureHandler failureHandler) {
        this.vertx = Objects.requireNonNull(vertx);
        this.failureHandler = failureHandler;

        setFixedBackoff(DEFAULT_BACKOFF_PERIOD);
        setRetries(retries);
    }

    /**
     * Sets the number of retries attempted before giving up. To retry forever, use a negative value.
     */
    public void setRetries(int retries) {
        this.retries = retries;
        this.unlimited = retries < 0;
    }

    public void setFixedBackoff(long period) {
        setBackoffPolicy(FixedBackoffPolicy.of(period));
    }

    /**
     * @param initDelay milliseconds to wait after the first attempt
     * @param maxDelay  upper bound of the wait in milliseconds
     * @param factor    base of the power by which the wait grows
     */
    public void setExponentialBackoff(long initDelay, long maxDelay, double factor) {
        setBackoffPolicy(ExponentialBackoffPolicy.of(initDelay, maxDelay, factor));
    }

    public void setBackoffPolicy(BackoffPolicy backoffPolicy) {
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy);
    }

    public int retries() {
        return retries;
    }

    public boolean isUnlimited() {
        return unlimited;
    }

    public BackoffPolicy backoffPolicy() {
        return backoffPolicy;
    }

    public Future<Void> execute(RetryOperation operation) {
        return execute(CancellationToken.create(), operation);
    }

    /**
     * Executes the given operation until it succeeds, retries run out or the token is cancelled.
     */
    public Future<Void> execute(CancellationToken token, RetryOperation operation) {
        Objects.requireNonNull(token);
        Objects.requireNonNull(operation);

        final Promise<Void> result = Promise.promise();
        attempt(token, operation, 1, result);
        return result.future();
    }

    private void attempt(CancellationToken token, RetryOperation operation, int attempt, Promise<Void> result) {
        if (token.isCancelled()) {
            logger.debug("Execution cancelled before attempt {}", attempt);
            result.fail(token.cause());
            return;
        }

        invoke(operation, attempt).onComplete(attemptResult -> {
            if (attemptResult.succeeded()) {
                result.complete();
                return;
            }

            try {
                handleFailure(token, operation, attempt, attemptResult.cause(), result);
            } catch (RuntimeException e) {
                logger.warn("Execution aborted after attempt {}", e, attempt);
                result.tryFail(e);
            }
        });
    }

    private static Future<Void> invoke(RetryOperation operation, int attempt) {
        final Future<Void> future;
        try {
            future = operation.execute(attempt);
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }

        return future != null
                ? future
                : Future.failedFuture(new NullPointerException("Operation returned null on attempt " + attempt));
    }

    private void handleFailure(CancellationToken token,
                               RetryOperation operation,
                               int attempt,
                               Throwable error,
                               Promise<Void> result) {

        if (!unlimited && attempt > retries) {
            logger.debug("Attempt {} failed, retries are exhausted", attempt);
            notifyFailure(error, attempt, false, 0L);
            result.fail(error);
            return;
        }

        final long delay = computeDelay(attempt);
        logger.debug("Attempt {} failed, retrying in {} ms", attempt, delay);
        notifyFailure(error, attempt, true, delay);

        final int nextAttempt = nextAttempt(attempt);
        waitFor(token, delay).onComplete(waitResult -> {
            if (waitResult.succeeded()) {
                attempt(token, operation, nextAttempt, result);
            } else {
                logger.debug("Execution cancelled while waiting for attempt {}", nextAttempt);
                result.fail(waitResult.cause());
            }
        });
    }

    /**
     * Attempt numbers stop growing at {@link Integer#MAX_VALUE}.
     */
    static int nextAttempt(int attempt) {
        return attempt == Integer.MAX_VALUE ? attempt : attempt + 1;
    }

    private long computeDelay(int attempt) {
        Validate.isTrue(attempt >= 1, "Attempt must be positive, but was %d", attempt);

        final BackoffPolicy policy = backoffPolicy;
        final long delay = policy.computeDelay(attempt);
        if (delay < 0) {
            logger.warn("Backoff policy {} returned negative delay {} for attempt {}, using 0",
                    policy, delay, attempt);
            return 0L;
        }
        return delay;
    }

    private void notifyFailure(Throwable error, int attempt, boolean willRetry, long nextDelay) {
        if (failureHandler == null) {
            return;
        }

        try {
            failureHandler.handle(error, attempt, willRetry, nextDelay);
        } catch (RuntimeException e) {
            logger.warn("Failure handler threw an exception on attempt {}", e, attempt);
        }
    }

    /**
     * Races a timer of the given delay against the token. Zero delay still yields to the event loop.
     */
    private Future<Void> waitFor(CancellationToken token, long delay) {
        if (token.isCancelled()) {
            return Future.failedFuture(token.cause());
        }

        final Promise<Void> promise = Promise.promise();
        final CancellationToken.Registration registration = token.onCancel(promise::tryFail);

        if (delay > 0) {
            final long timerId = vertx.setTimer(delay, ignored -> promise.tryComplete());
            promise.future().onFailure(ignored -> vertx.cancelTimer(timerId));
        } else {
            vertx.runOnContext(ignored -> promise.tryComplete());
        }

        return promise.future().onComplete(ignored -> registration.unregister());
    }
}
