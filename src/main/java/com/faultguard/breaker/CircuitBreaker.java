package com.faultguard.breaker;

import com.faultguard.common.ErrorClassifier;
import com.faultguard.common.ErrorKinds;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fault-isolation state machine shared by every caller of one downstream dependency.
 * <p>
 * CLOSED counts consecutive classified failures and opens at {@code failureThreshold}. OPEN rejects
 * calls with {@link CircuitBreakerOpenException} until {@code recoveryTimeout} has passed since the
 * last failure; the next call then moves it to HALF_OPEN, checked lazily on that call (no timer).
 * HALF_OPEN admits one trial call at a time: success closes the circuit, a classified failure
 * reopens it. Errors the classifier does not match pass through without touching state.
 * <p>
 * All state is guarded by one lock; the protected operation itself runs outside the lock.
 */
@Slf4j
public class CircuitBreaker {

    private enum Admission { NORMAL, TRIAL }

    private final String name;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final ErrorClassifier classifier;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;
    private boolean trialInFlight;
    private long successCount;
    private long totalRequests;
    private long totalBlocked;
    private Instant lastSuccessTime;
    private Instant lastStateChange;

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout) {
        this(name, failureThreshold, recoveryTimeout, ErrorClassifier.all(), Clock.systemUTC());
    }

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout, ErrorClassifier classifier) {
        this(name, failureThreshold, recoveryTimeout, classifier, Clock.systemUTC());
    }

    public CircuitBreaker(String name,
                          int failureThreshold,
                          Duration recoveryTimeout,
                          ErrorClassifier classifier,
                          Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must be non-negative");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.classifier = classifier != null ? classifier : ErrorClassifier.all();
        this.clock = clock != null ? clock : Clock.systemUTC();
        log.info("Circuit breaker '{}' initialized: failureThreshold={}, recoveryTimeout={}",
                name, failureThreshold, recoveryTimeout);
    }

    /**
     * Invokes the operation unless the circuit rejects it, and records the outcome.
     *
     * @throws CircuitBreakerOpenException if the call was rejected; the operation was not invoked
     * @throws Exception                   whatever the operation threw, unchanged
     */
    public <T> T call(Callable<T> operation) throws Exception {
        Admission admission = admit();
        T result;
        try {
            result = operation.call();
        } catch (Throwable t) {
            recordFailure(admission, t);
            throw t;
        }
        recordSuccess(admission);
        return result;
    }

    /**
     * Reactive variant of {@link #call}: admission happens on subscription, the outcome is recorded
     * when the Mono terminates. A cancelled trial frees the trial slot without a transition.
     */
    public <T> Mono<T> callAsync(Supplier<? extends Mono<T>> operation) {
        return Mono.defer(() -> {
            Admission admission = admit();
            return Mono.defer(operation::get)
                    .doOnSuccess(value -> recordSuccess(admission))
                    .doOnError(error -> recordFailure(admission, error))
                    .doOnCancel(() -> release(admission));
        });
    }

    public <T> Callable<T> wrap(Callable<T> operation) {
        return () -> call(operation);
    }

    public <T> Supplier<Mono<T>> wrapAsync(Supplier<? extends Mono<T>> operation) {
        return () -> callAsync(operation);
    }

    private Admission admit() {
        lock.lock();
        try {
            totalRequests++;
            if (state == CircuitState.OPEN) {
                if (!recoveryTimeoutElapsed()) {
                    totalBlocked++;
                    throw new CircuitBreakerOpenException(name, CircuitState.OPEN, remainingOpenTime());
                }
                transitionTo(CircuitState.HALF_OPEN);
                log.info("Circuit breaker '{}' half-open after {}, admitting trial call", name, recoveryTimeout);
            }
            if (state == CircuitState.HALF_OPEN) {
                if (trialInFlight) {
                    totalBlocked++;
                    throw new CircuitBreakerOpenException(name, CircuitState.HALF_OPEN, Duration.ZERO);
                }
                trialInFlight = true;
                return Admission.TRIAL;
            }
            return Admission.NORMAL;
        } finally {
            lock.unlock();
        }
    }

    private void recordSuccess(Admission admission) {
        lock.lock();
        try {
            successCount++;
            lastSuccessTime = clock.instant();
            if (admission == Admission.TRIAL) {
                trialInFlight = false;
                if (state == CircuitState.HALF_OPEN) {
                    failureCount = 0;
                    transitionTo(CircuitState.CLOSED);
                    log.info("Circuit breaker '{}' closed after successful trial call", name);
                }
            } else if (state == CircuitState.CLOSED && failureCount > 0) {
                log.debug("Circuit breaker '{}' resetting failure count {}", name, failureCount);
                failureCount = 0;
            }
        } finally {
            lock.unlock();
        }
    }

    private void recordFailure(Admission admission, Throwable error) {
        boolean classified = false;
        try {
            classified = classifier.matches(error);
        } catch (RuntimeException e) {
            log.warn("Circuit breaker '{}' classifier failed on {}; treating it as unclassified",
                    name, ErrorKinds.kindOf(error), e);
        } finally {
            if (!classified) {
                release(admission);
            }
        }
        if (!classified) {
            log.debug("Circuit breaker '{}' ignoring unclassified error {}", name, ErrorKinds.kindOf(error));
            return;
        }
        lock.lock();
        try {
            failureCount++;
            if (admission == Admission.TRIAL) {
                trialInFlight = false;
                if (state == CircuitState.HALF_OPEN) {
                    lastFailureTime = clock.instant();
                    transitionTo(CircuitState.OPEN);
                    log.error("Circuit breaker '{}' reopened: trial call failed with {}", name, ErrorKinds.kindOf(error));
                }
            } else if (state == CircuitState.CLOSED) {
                lastFailureTime = clock.instant();
                log.warn("Circuit breaker '{}' recorded failure {}/{}: {}",
                        name, failureCount, failureThreshold, ErrorKinds.kindOf(error));
                if (failureCount >= failureThreshold) {
                    transitionTo(CircuitState.OPEN);
                    log.error("Circuit breaker '{}' opened after {} failures; recovery in {}",
                            name, failureCount, recoveryTimeout);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private void release(Admission admission) {
        if (admission != Admission.TRIAL) {
            return;
        }
        lock.lock();
        try {
            trialInFlight = false;
        } finally {
            lock.unlock();
        }
    }

    private boolean recoveryTimeoutElapsed() {
        if (lastFailureTime == null) {
            return true;
        }
        return Duration.between(lastFailureTime, clock.instant()).compareTo(recoveryTimeout) >= 0;
    }

    private Duration remainingOpenTime() {
        if (lastFailureTime == null) {
            return Duration.ZERO;
        }
        return recoveryTimeout.minus(Duration.between(lastFailureTime, clock.instant()));
    }

    private void transitionTo(CircuitState next) {
        state = next;
        lastStateChange = clock.instant();
    }

    public String getName() {
        return name;
    }

    /** State as last recorded; an expired OPEN state reads OPEN until the next call. */
    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int getFailureCount() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getRecoveryTimeout() {
        return recoveryTimeout;
    }

    public CircuitBreakerStats getStats() {
        lock.lock();
        try {
            return new CircuitBreakerStats(name, state, failureCount, failureThreshold, recoveryTimeout,
                    successCount, totalRequests, totalBlocked, lastFailureTime, lastSuccessTime, lastStateChange);
        } finally {
            lock.unlock();
        }
    }
}
