package com.authplatform.credentialsvc.domain.ratelimit;

import java.time.Duration;

public record RateLimitPolicy(int points, Duration window) {

    public RateLimitPolicy {
        if (points < 1) {
            throw new IllegalArgumentException("points must be positive");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
    }
}
