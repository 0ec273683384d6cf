package com.faultguard.retry;

import com.faultguard.common.ErrorClassifier;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with optional multiplicative jitter, plus the retry classification used by
 * {@link RetryExecutor}. Immutable.
 */
public final class BackoffStrategy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
    public static final double DEFAULT_EXPONENTIAL_BASE = 2.0;
    public static final double DEFAULT_JITTER_LOW = 0.5;
    public static final double DEFAULT_JITTER_HIGH = 1.5;

    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double exponentialBase;
    private final boolean jitterEnabled;
    private final double jitterLow;
    private final double jitterHigh;
    private final List<Class<? extends Throwable>> retryableErrors;
    private final ErrorClassifier classifier;
    private final Duration stopAfterDelay;

    /**
     * @param retryableErrors error types retried when no classifier is given; empty means {@link Exception}
     * @param classifier      custom predicate; when non-null it decides alone and retryableErrors is ignored
     * @param stopAfterDelay  wall-clock budget for the whole execution, or null for none
     */
    public BackoffStrategy(int maxAttempts,
                           Duration initialDelay,
                           Duration maxDelay,
                           double exponentialBase,
                           boolean jitterEnabled,
                           double jitterLow,
                           double jitterHigh,
                           List<Class<? extends Throwable>> retryableErrors,
                           ErrorClassifier classifier,
                           Duration stopAfterDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be non-negative");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (!(exponentialBase > 1.0) || Double.isInfinite(exponentialBase)) {
            throw new IllegalArgumentException("exponentialBase must be > 1");
        }
        if (!Double.isFinite(jitterLow) || !Double.isFinite(jitterHigh)) {
            throw new IllegalArgumentException("jitter range bounds must be finite");
        }
        if (jitterLow < 0 || jitterHigh < jitterLow) {
            throw new IllegalArgumentException("jitter range must satisfy 0 <= low <= high");
        }
        if (stopAfterDelay != null && stopAfterDelay.isNegative()) {
            throw new IllegalArgumentException("stopAfterDelay must be non-negative");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.exponentialBase = exponentialBase;
        this.jitterEnabled = jitterEnabled;
        this.jitterLow = jitterLow;
        this.jitterHigh = jitterHigh;
        this.retryableErrors = retryableErrors == null || retryableErrors.isEmpty()
                ? List.of(Exception.class)
                : List.copyOf(retryableErrors);
        this.classifier = classifier;
        this.stopAfterDelay = stopAfterDelay;
    }

    /**
     * 3 attempts, 1s initial delay doubling up to 60s, jitter in [0.5, 1.5], every exception retryable.
     */
    public static BackoffStrategy defaultStrategy() {
        return new BackoffStrategy(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY,
                DEFAULT_EXPONENTIAL_BASE, true, DEFAULT_JITTER_LOW, DEFAULT_JITTER_HIGH,
                List.of(), null, null);
    }

    /**
     * Delay to wait after the given zero-based attempt failed.
     * Formula: min(initialDelay * base^attempt, maxDelay), then jitter clamped to [0, maxDelay].
     * Saturates at {@code Long.MAX_VALUE} nanoseconds, so a huge maxDelay means no ceiling.
     */
    public Duration delay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be non-negative");
        }
        double ceiling = nanos(maxDelay);
        double computed = Math.min(nanos(initialDelay) * Math.pow(exponentialBase, attempt), ceiling);
        if (jitterEnabled) {
            computed = clamp(computed * jitterFactor(), ceiling);
        }
        // Math.round saturates at Long.MAX_VALUE
        return Duration.ofNanos(Math.round(computed));
    }

    private static double nanos(Duration duration) {
        return duration.getSeconds() * 1e9 + duration.getNano();
    }

    private double jitterFactor() {
        if (jitterHigh == jitterLow) {
            return jitterLow;
        }
        return ThreadLocalRandom.current().nextDouble(jitterLow, jitterHigh);
    }

    private static double clamp(double value, double ceiling) {
        return Math.max(0, Math.min(value, ceiling));
    }

    public boolean shouldRetry(Throwable error) {
        if (classifier != null) {
            return classifier.matches(error);
        }
        return retryableErrors.stream().anyMatch(t -> t.isInstance(error));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getExponentialBase() {
        return exponentialBase;
    }

    public boolean isJitterEnabled() {
        return jitterEnabled;
    }

    public double getJitterLow() {
        return jitterLow;
    }

    public double getJitterHigh() {
        return jitterHigh;
    }

    public Optional<Duration> getStopAfterDelay() {
        return Optional.ofNullable(stopAfterDelay);
    }
}
