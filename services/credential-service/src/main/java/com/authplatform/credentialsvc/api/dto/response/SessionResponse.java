package com.authplatform.credentialsvc.api.dto.response;

import java.time.Instant;
import java.util.UUID;

/**
 * Access token for the Authorization header. The session token travels only in the cookie.
 */
public record SessionResponse(
        String accessToken,
        String tokenType,
        Instant expiresAt,
        UUID userId
) {
    public static final String BEARER = "Bearer";
}
