package com.faultguard.api.controller;

import com.faultguard.api.dto.CircuitBreakerStatusResponse;
import com.faultguard.api.dto.ErrorBody;
import com.faultguard.breaker.CircuitBreaker;
import com.faultguard.breaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;

/**
 * Read-only breaker status for health checks. Reading never changes breaker state.
 */
@RestController
@RequestMapping("/api/v1/circuit-breakers")
@RequiredArgsConstructor
public class CircuitBreakerController {

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final Clock clock;

    @GetMapping
    public List<CircuitBreakerStatusResponse> list() {
        return circuitBreakerRegistry.getAllStats().values().stream()
                .map(CircuitBreakerStatusResponse::from)
                .toList();
    }

    @GetMapping("/{name}")
    public ResponseEntity<?> get(@PathVariable String name) {
        return circuitBreakerRegistry.get(name)
                .map(CircuitBreaker::getStats)
                .<ResponseEntity<?>>map(stats -> ResponseEntity.ok(CircuitBreakerStatusResponse.from(stats)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorBody.of("NOT_FOUND", "Unknown circuit breaker: " + name, clock)));
    }
}
