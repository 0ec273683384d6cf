package com.faultguard.api.controller;

import com.faultguard.api.dto.ErrorBody;
import com.faultguard.breaker.CircuitBreakerOpenException;
import com.faultguard.retry.RetryExhaustedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.time.Duration;

/**
 * Maps resilience failures escaping a handler to 503 with ErrorBody. A known-down dependency
 * (CIRCUIT_OPEN) is reported apart from a call that failed after retrying (RETRY_EXHAUSTED).
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class ResilienceExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(CircuitBreakerOpenException.class)
    public ResponseEntity<ErrorBody> handleCircuitOpen(CircuitBreakerOpenException ex) {
        // whole seconds, rounded up
        Duration retryAfter = ex.getRetryAfter();
        long retryAfterSeconds = retryAfter.getNano() > 0 ? retryAfter.getSeconds() + 1 : retryAfter.getSeconds();
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds))
                .body(ErrorBody.of("CIRCUIT_OPEN", "Dependency '" + ex.getBreakerName() + "' is unavailable", clock));
    }

    @ExceptionHandler(RetryExhaustedException.class)
    public ResponseEntity<ErrorBody> handleRetryExhausted(RetryExhaustedException ex) {
        log.warn("Request failed after {} attempts: {}", ex.getAttempts(), ex.getStatistics());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("RETRY_EXHAUSTED", "Upstream call failed after " + ex.getAttempts() + " attempts", clock));
    }
}
