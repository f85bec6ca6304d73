package org.retrier.execution;

/**
 * Notified synchronously once per failed attempt, whether another attempt follows or not.
 */
@FunctionalInterface
public interface RetryFailureHandler {

    /**
     * @param error     failure of the attempt
     * @param attempt   1-indexed number of the failed attempt
     * @param willRetry whether another attempt is scheduled
     * @param nextDelay milliseconds until the next attempt, 0 when {@code willRetry} is false
     */
    void handle(Throwable error, int attempt, boolean willRetry, long nextDelay);
}
