package com.faultguard.api.dto;

import com.faultguard.breaker.CircuitBreakerStats;

import java.time.Instant;

/**
 * One breaker in GET /api/v1/circuit-breakers.
 */
public record CircuitBreakerStatusResponse(
        String name,
        String state,
        int failureCount,
        int failureThreshold,
        long recoveryTimeoutMs,
        long successCount,
        long totalRequests,
        long totalBlocked,
        double failureRate,
        Instant lastFailureTime,
        Instant lastSuccessTime,
        Instant lastStateChange
) {

    public static CircuitBreakerStatusResponse from(CircuitBreakerStats stats) {
        return new CircuitBreakerStatusResponse(
                stats.name(),
                stats.state().name(),
                stats.failureCount(),
                stats.failureThreshold(),
                stats.recoveryTimeout().toMillis(),
                stats.successCount(),
                stats.totalRequests(),
                stats.totalBlocked(),
                stats.failureRate(),
                stats.lastFailureTime(),
                stats.lastSuccessTime(),
                stats.lastStateChange());
    }
}
