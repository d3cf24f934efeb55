package com.authplatform.credentialsvc.domain.ratelimit;

/**
 * Throttled request families. Both are keyed by client IP.
 */
public enum RateLimitScope {
    AUTH("auth"),
    GENERAL_API("api");

    private final String keySegment;

    RateLimitScope(String keySegment) {
        this.keySegment = keySegment;
    }

    public String keySegment() {
        return keySegment;
    }
}
