package com.authplatform.credentialsvc.api.dto.response;

import com.authplatform.credentialsvc.domain.profile.ProfileService.ProfileData;

import java.time.Instant;
import java.util.UUID;

public record CurrentUserResponse(
    UUID userId,
    String email,
    String displayName,
    boolean emailVerified,
    Instant memberSince
) {
    public static CurrentUserResponse from(ProfileData profile) {
        return new CurrentUserResponse(profile.id(), profile.email(), profile.displayName(),
                profile.emailVerified(), profile.createdAt());
    }
}
