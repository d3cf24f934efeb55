package com.authplatform.credentialsvc.api.dto.request;

import jakarta.validation.constraints.NotBlank;

public record PasswordResetRequest(
        @NotBlank(message = "Token is required")
        String token,

        @NotBlank(message = "New password is required")
        String newPassword
) {
    @Override
    public String toString() {
        return "PasswordResetRequest[token=***, newPassword=***]";
    }
}
