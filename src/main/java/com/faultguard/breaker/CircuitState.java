package com.faultguard.breaker;

/**
 * CLOSED: calls pass. OPEN: calls rejected until the recovery timeout elapses.
 * HALF_OPEN: a single trial call decides between CLOSED and OPEN.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
