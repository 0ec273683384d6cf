package com.faultguard.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Retry defaults and per-dependency circuit breakers. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "faultguard.resilience")
@NoArgsConstructor
@Getter
@Setter
public class ResilienceProperties {

    private RetryEntry retry = new RetryEntry();

    /**
     * Breakers created at startup. Key: breaker name (one per downstream dependency, e.g. "payments-api").
     */
    private Map<String, BreakerEntry> breakers = new HashMap<>();

    public void setRetry(RetryEntry retry) {
        this.retry = retry != null ? retry : new RetryEntry();
    }

    public void setBreakers(Map<String, BreakerEntry> breakers) {
        this.breakers = breakers != null ? breakers : new HashMap<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class RetryEntry {

        /** Total attempts including the first call. Default 3. */
        private int maxAttempts = 3;

        /** Delay after the first failure; multiplied by exponentialBase per attempt. Default 1000. */
        private long initialDelayMs = 1000L;

        /** Ceiling for a single delay. Default 60000. */
        private long maxDelayMs = 60_000L;

        private double exponentialBase = 2.0;

        private boolean jitterEnabled = true;

        /** Lower multiplier of the jitter range. Default 0.5. */
        private double jitterLow = 0.5;

        /** Upper multiplier of the jitter range. Default 1.5. */
        private double jitterHigh = 1.5;

        /** Wall-clock budget for a whole run; null = attempts only. */
        private Long stopAfterDelayMs;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class BreakerEntry {

        /** Consecutive classified failures that open the circuit. Default 5. */
        private int failureThreshold = 5;

        /** Time in OPEN before a trial call is admitted. Default 60000. */
        private long recoveryTimeoutMs = 60_000L;
    }
}
