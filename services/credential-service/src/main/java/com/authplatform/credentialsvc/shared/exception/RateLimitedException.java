package com.authplatform.credentialsvc.shared.exception;

import java.time.Duration;

public final class RateLimitedException extends CredentialServiceException {

    private final Duration retryAfter;

    public RateLimitedException(Duration retryAfter) {
        super("Rate limit exceeded");
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    /**
     * Seconds until the caller may retry, rounded up and never below one.
     */
    public long getRetryAfterSeconds() {
        long seconds = retryAfter.toSeconds();
        if (retryAfter.toNanosPart() > 0) {
            seconds++;
        }
        return Math.max(1, seconds);
    }

    @Override
    public String getErrorCode() {
        return "RATE_LIMITED";
    }

    @Override
    public int getHttpStatus() {
        return 429;
    }
}
