package com.authplatform.credentialsvc.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breaker guarding the shared rate limit store.
 */
@Configuration
@Slf4j
public class RateLimitConfig {

    @Bean
    public CircuitBreaker rateLimitStoreCircuitBreaker(
            @Value("${app.rate-limit.circuit-breaker.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${app.rate-limit.circuit-breaker.wait-in-open-seconds:30}") long waitInOpenSeconds,
            @Value("${app.rate-limit.circuit-breaker.sliding-window-size:10}") int slidingWindowSize,
            @Value("${app.rate-limit.circuit-breaker.minimum-calls:5}") int minimumCalls) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitInOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .minimumNumberOfCalls(minimumCalls)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .build();

        CircuitBreaker circuitBreaker = CircuitBreakerRegistry.of(config).circuitBreaker("rateLimitStore");
        circuitBreaker.getEventPublisher().onStateTransition(event ->
                log.warn("Rate limit store circuit breaker: {}", event.getStateTransition()));
        return circuitBreaker;
    }
}
