package com.faultguard.retry;

/**
 * Thrown when the attempt budget or the time budget of a {@link RetryExecutor} run is spent.
 * The last underlying error is both {@link #getLastError()} and the cause.
 */
public class RetryExhaustedException extends RuntimeException {

    private final Throwable lastError;
    private final int attempts;
    private final RetryStatistics statistics;

    public RetryExhaustedException(Throwable lastError, int attempts, RetryStatistics statistics) {
        super("Failed after " + attempts + " attempts. Last error: " + lastError, lastError);
        this.lastError = lastError;
        this.attempts = attempts;
        this.statistics = statistics;
    }

    public Throwable getLastError() {
        return lastError;
    }

    public int getAttempts() {
        return attempts;
    }

    public RetryStatistics getStatistics() {
        return statistics;
    }
}
