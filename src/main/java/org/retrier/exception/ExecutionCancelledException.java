package org.retrier.exception;

/**
 * Default cause of a cancelled {@link org.retrier.execution.CancellationToken}.
 */
@SuppressWarnings("serial")
public class ExecutionCancelledException extends RuntimeException {

    public ExecutionCancelledException(String message) {
        super(message);
    }
}
