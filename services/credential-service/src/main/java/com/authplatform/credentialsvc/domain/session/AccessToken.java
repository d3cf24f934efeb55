package com.authplatform.credentialsvc.domain.session;

import java.time.Instant;

public record AccessToken(String value, Instant expiresAt) {
}
