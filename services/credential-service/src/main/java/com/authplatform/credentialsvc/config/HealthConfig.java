package com.authplatform.credentialsvc.config;

import com.authplatform.credentialsvc.domain.ratelimit.RateLimitService;
import com.authplatform.credentialsvc.domain.ratelimit.RedisLimiterBackend;
import com.authplatform.credentialsvc.infra.persistence.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The limiter store being down degrades throttling but not the service, so it reports
 * UP with details instead of DOWN.
 */
@Configuration
@RequiredArgsConstructor
public class HealthConfig {

    private final RedisLimiterBackend redisLimiterBackend;
    private final RateLimitService rateLimitService;
    private final OutboxEventRepository outboxEventRepository;

    @Bean
    public HealthIndicator rateLimiterHealthIndicator() {
        return () -> {
            String activeBackend = rateLimitService.isSharedBackendActive() ? "redis" : "local";
            try {
                boolean reachable = redisLimiterBackend.ping();
                return Health.up()
                        .withDetail("activeBackend", activeBackend)
                        .withDetail("sharedStore", reachable ? "reachable" : "unexpected reply")
                        .build();
            } catch (RuntimeException e) {
                return Health.up()
                        .withDetail("activeBackend", activeBackend)
                        .withDetail("sharedStore", "unreachable")
                        .withDetail("error", e.getMessage())
                        .build();
            }
        };
    }

    /** Pending notifications; a growing backlog means the broker is not taking sends. */
    @Bean
    public HealthIndicator outboxHealthIndicator() {
        return () -> Health.up()
                .withDetail("pendingEvents", outboxEventRepository.countByDispatchedAtIsNull())
                .build();
    }
}
