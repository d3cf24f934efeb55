package com.authplatform.credentialsvc.domain.ratelimit;

import java.time.Duration;

/**
 * Outcome of one rate limit check. {@code metered} is false when the check was skipped
 * because the counter store failed.
 */
public record RateLimitDecision(
        boolean allowed,
        boolean metered,
        int limit,
        long remaining,
        Duration resetAfter
) {
    static RateLimitDecision allowed(RateLimitPolicy policy, long count, Duration resetAfter) {
        return new RateLimitDecision(true, true, policy.points(), Math.max(0, policy.points() - count), resetAfter);
    }

    static RateLimitDecision denied(RateLimitPolicy policy, Duration resetAfter) {
        return new RateLimitDecision(false, true, policy.points(), 0, resetAfter);
    }

    static RateLimitDecision unmetered(RateLimitPolicy policy) {
        return new RateLimitDecision(true, false, policy.points(), policy.points(), policy.window());
    }

    /**
     * Whole seconds until the bucket resets, rounded up, at least 1.
     */
    public long retryAfterSeconds() {
        long seconds = resetAfter.toSeconds();
        if (resetAfter.toNanosPart() > 0) {
            seconds++;
        }
        return Math.max(1, seconds);
    }
}
