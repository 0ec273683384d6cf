package com.faultguard.retry;

/**
 * Observer invoked before each backoff sleep, e.g. for logging or metrics.
 * Exceptions thrown here are logged and do not stop the retry loop.
 */
@FunctionalInterface
public interface RetryListener {

    /**
     * @param error   failure of the attempt that is about to be retried
     * @param attempt one-based number of the failed attempt
     */
    void onRetry(Throwable error, int attempt);
}
