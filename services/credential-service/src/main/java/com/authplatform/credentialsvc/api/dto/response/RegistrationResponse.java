package com.authplatform.credentialsvc.api.dto.response;

import java.util.UUID;

public record RegistrationResponse(
        UUID userId,
        String email,
        String message
) {}
