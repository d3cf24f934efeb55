package com.authplatform.credentialsvc.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "Email is required")
        @Size(max = 255, message = "Email too long")
        String email,

        @NotBlank(message = "Password is required")
        String password,

        String displayName
) {}
