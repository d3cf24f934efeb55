package com.authplatform.credentialsvc.domain.ratelimit;

import java.time.Duration;

/**
 * Fixed-window counter store. Increments must be atomic per key: concurrent callers never lose a count.
 */
public interface LimiterBackend {

    /**
     * Adds one point to {@code key}, starting a new window of {@code window} if none is open.
     *
     * @throws RuntimeException on an operational failure of the store (connectivity, timeout)
     */
    BucketState increment(String key, Duration window);

    String name();
}
