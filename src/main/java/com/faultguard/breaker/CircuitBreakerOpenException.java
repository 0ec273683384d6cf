package com.faultguard.breaker;

import java.time.Duration;

/**
 * Thrown when a breaker rejects a call without invoking the protected operation: the circuit is OPEN,
 * or HALF_OPEN with its single trial call already in flight.
 */
public class CircuitBreakerOpenException extends RuntimeException {

    private final String breakerName;
    private final CircuitState state;
    private final Duration retryAfter;

    public CircuitBreakerOpenException(String breakerName, CircuitState state, Duration retryAfter) {
        super("Circuit breaker '" + breakerName + "' is " + state);
        this.breakerName = breakerName;
        this.state = state;
        this.retryAfter = retryAfter.isNegative() ? Duration.ZERO : retryAfter;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public CircuitState getState() {
        return state;
    }

    /** Time until the breaker admits a trial call; zero when a trial is already running. */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
