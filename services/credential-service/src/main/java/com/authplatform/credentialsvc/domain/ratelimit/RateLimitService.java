package com.authplatform.credentialsvc.domain.ratelimit;

import com.authplatform.credentialsvc.config.CredentialMetrics;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Point-bucket throttling over a shared Redis store with an in-process fallback.
 * Keys live under the "credential-service:ratelimit" namespace.
 *
 * <p>Backend choice is a single read of the circuit breaker state: while the breaker is open
 * the local backend counts. Any other store failure is fail-open: the request passes unmetered
 * and the event is logged and counted.
 */
@Service
@Slf4j
public class RateLimitService {

    public static final String NAMESPACE = "credential-service:ratelimit";

    private final LimiterBackend sharedBackend;
    private final LimiterBackend localBackend;
    private final CircuitBreaker circuitBreaker;
    private final CredentialMetrics metrics;
    private final Map<RateLimitScope, RateLimitPolicy> policies;

    @Autowired
    public RateLimitService(
            @Qualifier("redisLimiterBackend") LimiterBackend sharedBackend,
            @Qualifier("localLimiterBackend") LimiterBackend localBackend,
            @Qualifier("rateLimitStoreCircuitBreaker") CircuitBreaker circuitBreaker,
            CredentialMetrics metrics,
            @Value("${app.rate-limit.auth.points:10}") int authPoints,
            @Value("${app.rate-limit.auth.window-seconds:3600}") long authWindowSeconds,
            @Value("${app.rate-limit.api.points:100}") int apiPoints,
            @Value("${app.rate-limit.api.window-seconds:900}") long apiWindowSeconds) {
        this(sharedBackend, localBackend, circuitBreaker, metrics, Map.of(
                RateLimitScope.AUTH, new RateLimitPolicy(authPoints, Duration.ofSeconds(authWindowSeconds)),
                RateLimitScope.GENERAL_API, new RateLimitPolicy(apiPoints, Duration.ofSeconds(apiWindowSeconds))));
    }

    public RateLimitService(
            LimiterBackend sharedBackend,
            LimiterBackend localBackend,
            CircuitBreaker circuitBreaker,
            CredentialMetrics metrics,
            Map<RateLimitScope, RateLimitPolicy> policies) {
        this.sharedBackend = sharedBackend;
        this.localBackend = localBackend;
        this.circuitBreaker = circuitBreaker;
        this.metrics = metrics;
        this.policies = new EnumMap<>(policies);
        for (RateLimitScope scope : RateLimitScope.values()) {
            if (!this.policies.containsKey(scope)) {
                throw new IllegalArgumentException("No rate limit policy for scope " + scope);
            }
        }
    }

    /**
     * Consumes one point from the {@code (scope, subject)} bucket.
     */
    public RateLimitDecision checkRateLimit(RateLimitScope scope, String subject) {
        RateLimitPolicy policy = policies.get(scope);
        String key = keyFor(scope, subject);

        Optional<BucketState> state = increment(scope, key, policy.window());
        if (state.isEmpty()) {
            return RateLimitDecision.unmetered(policy);
        }

        BucketState bucket = state.get();
        if (bucket.count() > policy.points()) {
            metrics.rateLimitDenied(scope);
            log.debug("Rate limit exceeded: scope={}, count={}, resetAfter={}", scope, bucket.count(), bucket.resetAfter());
            return RateLimitDecision.denied(policy, bucket.resetAfter());
        }
        return RateLimitDecision.allowed(policy, bucket.count(), bucket.resetAfter());
    }

    public RateLimitPolicy policyFor(RateLimitScope scope) {
        return policies.get(scope);
    }

    public String keyFor(RateLimitScope scope, String subject) {
        return NAMESPACE + ":" + scope.keySegment() + ":" + (subject == null || subject.isBlank() ? "unknown" : subject);
    }

    /**
     * True when the shared store is the backend that would be used right now.
     */
    public boolean isSharedBackendActive() {
        CircuitBreaker.State state = circuitBreaker.getState();
        return state != CircuitBreaker.State.OPEN && state != CircuitBreaker.State.FORCED_OPEN;
    }

    private Optional<BucketState> increment(RateLimitScope scope, String key, Duration window) {
        if (!isSharedBackendActive()) {
            return Optional.of(localBackend.increment(key, window));
        }
        try {
            return Optional.of(circuitBreaker.executeSupplier(() -> sharedBackend.increment(key, window)));
        } catch (CallNotPermittedException e) {
            // breaker opened between the state read and the call
            return Optional.of(localBackend.increment(key, window));
        } catch (RuntimeException e) {
            metrics.rateLimitFailOpen(scope);
            log.warn("Rate limit store {} failed, allowing request: scope={}, error={}",
                    sharedBackend.name(), scope, e.getMessage());
            return Optional.empty();
        }
    }
}
