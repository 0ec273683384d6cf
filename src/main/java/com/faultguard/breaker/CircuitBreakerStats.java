package com.faultguard.breaker;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time snapshot of a {@link CircuitBreaker} for health reporting.
 * Timestamps are null until the corresponding event happened.
 */
public record CircuitBreakerStats(
        String name,
        CircuitState state,
        int failureCount,
        int failureThreshold,
        Duration recoveryTimeout,
        long successCount,
        long totalRequests,
        long totalBlocked,
        Instant lastFailureTime,
        Instant lastSuccessTime,
        Instant lastStateChange
) {

    /** Current consecutive failures relative to all requests seen; 0 when there were none. */
    public double failureRate() {
        if (totalRequests == 0) {
            return 0.0;
        }
        return (double) failureCount / totalRequests;
    }
}
