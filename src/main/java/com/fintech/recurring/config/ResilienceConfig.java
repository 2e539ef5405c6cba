package com.fintech.recurring.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breaker settings for the ledger collaborator.
 * <p>
 * A generation pass may hit the ledger once per due template; when the ledger keeps failing the
 * breaker opens and the remaining templates of the pass fail fast and stay due.
 * <p>
 * States:
 * - CLOSED: Normal operation, calls pass through
 * - OPEN: Ledger is failing, calls fail fast
 * - HALF_OPEN: Testing if the ledger has recovered
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(
            @Value("${recurring.ledger.circuit-breaker.sliding-window-size:10}") int slidingWindowSize,
            @Value("${recurring.ledger.circuit-breaker.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${recurring.ledger.circuit-breaker.wait-in-open-state:PT30S}") Duration waitInOpenState) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowSize(slidingWindowSize)
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(waitInOpenState)
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .build();

        return CircuitBreakerRegistry.of(config);
    }
}
