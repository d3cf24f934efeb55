package com.authplatform.credentialsvc.api.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Body of the endpoints keyed only by an address (resend verification, forgot password).
 * Both answer identically for known and unknown addresses.
 */
public record EmailAddressRequest(
    @NotBlank(message = "Email is required")
    @Email(message = "Invalid email format")
    @Size(max = 255, message = "Email too long")
    String email
) {}
