package com.authplatform.credentialsvc.domain.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * In-process counters used while the shared store is known to be down.
 * Window expiry is computed from the injected clock; Caffeine only bounds memory.
 */
@Component
public class LocalLimiterBackend implements LimiterBackend {

    private final Cache<String, Bucket> buckets;
    private final Clock clock;

    public LocalLimiterBackend(
            Clock clock,
            @Value("${app.rate-limit.local.max-keys:100000}") long maxKeys,
            @Value("${app.rate-limit.local.idle-eviction-minutes:120}") long idleEvictionMinutes) {
        this.clock = clock;
        this.buckets = Caffeine.newBuilder()
                .maximumSize(maxKeys)
                .expireAfterAccess(Duration.ofMinutes(idleEvictionMinutes))
                .build();
    }

    @Override
    public BucketState increment(String key, Duration window) {
        Bucket bucket = buckets.get(key, k -> new Bucket());
        return bucket.increment(clock.instant(), window);
    }

    @Override
    public String name() {
        return "local";
    }

    long trackedKeys() {
        buckets.cleanUp();
        return buckets.estimatedSize();
    }

    private static final class Bucket {

        private long count;
        private Instant resetAt = Instant.MIN;

        synchronized BucketState increment(Instant now, Duration window) {
            if (!now.isBefore(resetAt)) {
                count = 0;
                resetAt = now.plus(window);
            }
            count++;
            return new BucketState(count, Duration.between(now, resetAt));
        }
    }
}
