package org.retrier.execution;

import io.vertx.core.Future;

/**
 * Operation retried by {@link Retrier}. A failed {@link Future} marks the attempt as failed.
 */
@FunctionalInterface
public interface RetryOperation {

    /**
     * @param attempt 1-indexed number of the current attempt
     */
    Future<Void> execute(int attempt);
}
