package com.pharmascope.helix.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Circuit breaker configuration for agent upstream sources.
 * <p>
 * A count-based window the size of the failure threshold with a 100% failure-rate threshold
 * opens the breaker after that many consecutive failures. The wait in OPEN grows
 * exponentially on every re-open from HALF_OPEN, capped at the configured maximum.
 */
@Slf4j
@Configuration
public class ResilienceConfig {

    @Bean
    public CircuitBreakerRegistry agentCircuitBreakerRegistry(HelixProperties helixProperties,
                                                               MeterRegistry meterRegistry) {
        HelixProperties.CircuitBreakerProperties config = helixProperties.getCircuitBreaker();
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(agentBreakerConfig(config));
        TaggedCircuitBreakerMetrics.ofCircuitBreakerRegistry(registry).bindTo(meterRegistry);

        log.info("Agent circuit breakers: threshold={}, openDuration={}, backoff={}x, maxOpenDuration={}",
                config.getFailureThreshold(), config.getOpenDuration(),
                config.getBackoffMultiplier(), config.getMaxOpenDuration());
        return registry;
    }

    public static CircuitBreakerConfig agentBreakerConfig(HelixProperties.CircuitBreakerProperties config) {
        int threshold = Math.max(1, config.getFailureThreshold());
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100.0f)
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .waitIntervalFunctionInOpenState(IntervalFunction.ofExponentialBackoff(
                        config.getOpenDuration(),
                        config.getBackoffMultiplier(),
                        config.getMaxOpenDuration()))
                .build();
    }
}
