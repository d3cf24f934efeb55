package com.authplatform.credentialsvc.shared.exception;

import java.util.UUID;

/**
 * The bearer token is valid but its subject no longer exists, e.g. the account was reaped
 * after the token was minted.
 */
public final class AccountNotFoundException extends CredentialServiceException {

    private final UUID userId;

    public AccountNotFoundException(UUID userId) {
        super("Account not found");
        this.userId = userId;
    }

    public UUID getUserId() {
        return userId;
    }

    @Override
    public String getErrorCode() {
        return "ACCOUNT_NOT_FOUND";
    }

    @Override
    public int getHttpStatus() {
        return 404;
    }
}
