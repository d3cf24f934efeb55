package com.authplatform.credentialsvc.domain.session;

import java.time.Instant;
import java.util.UUID;

/**
 * Result of login or rotation. {@code sessionToken} is the raw refresh token; it exists only here
 * and in the client's cookie.
 */
public record SessionTokens(
        UUID userId,
        AccessToken accessToken,
        String sessionToken,
        Instant sessionExpiresAt
) {
    @Override
    public String toString() {
        return "SessionTokens[userId=" + userId + ", sessionExpiresAt=" + sessionExpiresAt + "]";
    }
}
