package com.faultguard.breaker;

import com.faultguard.common.ErrorClassifier;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link CircuitBreaker} per protected dependency, keyed by name. Owned by the application
 * context and handed to call sites by reference.
 */
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Clock clock;

    public CircuitBreakerRegistry() {
        this(Clock.systemUTC());
    }

    public CircuitBreakerRegistry(Clock clock) {
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Existing breaker for {@code name}, or a new one with the given settings. Settings of an existing
     * breaker are never changed.
     */
    public CircuitBreaker getOrCreate(String name, int failureThreshold, Duration recoveryTimeout) {
        return getOrCreate(name, failureThreshold, recoveryTimeout, ErrorClassifier.all());
    }

    public CircuitBreaker getOrCreate(String name, int failureThreshold, Duration recoveryTimeout,
                                      ErrorClassifier classifier) {
        return breakers.computeIfAbsent(name,
                n -> new CircuitBreaker(n, failureThreshold, recoveryTimeout, classifier, clock));
    }

    public Optional<CircuitBreaker> get(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public Collection<CircuitBreaker> getAll() {
        return List.copyOf(breakers.values());
    }

    /** Snapshot per breaker, ordered by name. */
    public Map<String, CircuitBreakerStats> getAllStats() {
        Map<String, CircuitBreakerStats> stats = new LinkedHashMap<>();
        breakers.keySet().stream()
                .sorted()
                .forEach(name -> stats.put(name, breakers.get(name).getStats()));
        return stats;
    }
}
