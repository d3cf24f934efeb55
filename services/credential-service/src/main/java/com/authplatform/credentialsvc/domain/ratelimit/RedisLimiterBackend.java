package com.authplatform.credentialsvc.domain.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Shared counters in Redis. INCR and the first-hit PEXPIRE run in one Lua script, so the window
 * is set exactly once per bucket and concurrent increments from any instance are never lost.
 * The remaining TTL is read afterwards and only feeds {@code Retry-After}.
 */
@Component
@Slf4j
public class RedisLimiterBackend implements LimiterBackend {

    private static final String INCREMENT_SCRIPT = """
            local current = redis.call('INCR', KEYS[1])
            if redis.call('PTTL', KEYS[1]) < 0 then
              redis.call('PEXPIRE', KEYS[1], ARGV[1])
            end
            return current
            """;

    private static final DefaultRedisScript<Long> SCRIPT = new DefaultRedisScript<>(INCREMENT_SCRIPT, Long.class);

    private final StringRedisTemplate redisTemplate;

    public RedisLimiterBackend(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public BucketState increment(String key, Duration window) {
        Long count = redisTemplate.execute(SCRIPT, List.of(key), String.valueOf(window.toMillis()));
        if (count == null) {
            throw new IllegalStateException("Rate limit script returned nothing for key " + key);
        }
        Long ttlMillis = redisTemplate.getExpire(key, TimeUnit.MILLISECONDS);
        // key can expire between the two calls; the next hit starts a fresh window
        Duration resetAfter = ttlMillis == null || ttlMillis < 0 ? window : Duration.ofMillis(ttlMillis);
        return new BucketState(count, resetAfter);
    }

    @Override
    public String name() {
        return "redis";
    }

    /**
     * Round-trip check used by the health indicator.
     */
    public boolean ping() {
        String reply = redisTemplate.execute(connection -> connection.ping(), true);
        return "PONG".equalsIgnoreCase(reply);
    }
}
