package com.authplatform.credentialsvc.shared.exception;

/**
 * Access token with a valid signature whose expiry has passed.
 * Session, code and reset credentials never surface this; they fail with {@link InvalidTokenException}.
 */
public final class ExpiredTokenException extends CredentialServiceException {

    public ExpiredTokenException() {
        super("Access token has expired");
    }

    @Override
    public String getErrorCode() {
        return "EXPIRED_TOKEN";
    }

    @Override
    public int getHttpStatus() {
        return 401;
    }
}
