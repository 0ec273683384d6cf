package com.faultguard.retry;

/**
 * Successful result of a retried operation with the statistics of its run.
 */
public record RetryOutcome<T>(T value, RetryStatistics statistics) {

    /** Total invocations of the operation: every failed attempt plus the successful one. */
    public int invocations() {
        return statistics.getAttemptsMade() + 1;
    }
}
