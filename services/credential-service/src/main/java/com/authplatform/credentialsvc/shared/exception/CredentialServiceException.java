package com.authplatform.credentialsvc.shared.exception;

/**
 * Base sealed exception for all Credential Service exceptions.
 * Each subtype carries a stable error code and the HTTP status it maps to.
 */
public sealed abstract class CredentialServiceException extends RuntimeException
        permits ValidationException, InvalidTokenException, ExpiredTokenException,
                RateLimitedException, ConflictException, AuthenticationFailedException,
                EmailNotVerifiedException, AccountNotFoundException {

    protected CredentialServiceException(String message) {
        super(message);
    }

    protected CredentialServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getErrorCode();
    public abstract int getHttpStatus();
}
