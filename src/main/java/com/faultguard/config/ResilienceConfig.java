package com.faultguard.config;

import com.faultguard.breaker.CircuitBreakerRegistry;
import com.faultguard.retry.RetryExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Application-level owners of the resilience primitives: the breaker registry (one breaker per
 * configured dependency) and a default retry executor built from faultguard.resilience.retry.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ResilienceProperties.class)
public class ResilienceConfig {

    public static final String DEFAULT_RETRY_EXECUTOR = "defaultRetryExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(ResilienceProperties properties, Clock clock) {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(clock);
        properties.getBreakers().forEach((name, entry) -> registry.getOrCreate(
                name, entry.getFailureThreshold(), Duration.ofMillis(entry.getRecoveryTimeoutMs())));
        log.info("Circuit breaker registry initialized with {} breaker(s)", properties.getBreakers().size());
        return registry;
    }

    @Bean(name = DEFAULT_RETRY_EXECUTOR)
    public RetryExecutor defaultRetryExecutor(ResilienceProperties properties, Clock clock) {
        ResilienceProperties.RetryEntry retry = properties.getRetry();
        return RetryExecutor.builder()
                .name("default")
                .maxAttempts(retry.getMaxAttempts())
                .initialDelay(Duration.ofMillis(retry.getInitialDelayMs()))
                .maxDelay(Duration.ofMillis(retry.getMaxDelayMs()))
                .exponentialBase(retry.getExponentialBase())
                .jitter(retry.isJitterEnabled())
                .jitterRange(retry.getJitterLow(), retry.getJitterHigh())
                .stopAfterDelay(retry.getStopAfterDelayMs() != null ? Duration.ofMillis(retry.getStopAfterDelayMs()) : null)
                .clock(clock)
                .build();
    }
}
