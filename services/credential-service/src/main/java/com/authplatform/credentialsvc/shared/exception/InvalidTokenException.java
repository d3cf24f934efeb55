package com.authplatform.credentialsvc.shared.exception;

/**
 * A credential that is absent, already consumed or past its expiry.
 * The message never says which of those applied.
 */
public final class InvalidTokenException extends CredentialServiceException {

    public enum Kind {
        ACCESS_TOKEN("Invalid access token", 401),
        SESSION_TOKEN("Invalid or expired session", 401),
        VERIFICATION_CODE("Invalid or expired verification code", 400),
        PASSWORD_RESET_TOKEN("Invalid or expired password reset token", 400);

        private final String message;
        private final int httpStatus;

        Kind(String message, int httpStatus) {
            this.message = message;
            this.httpStatus = httpStatus;
        }
    }

    private final Kind kind;

    public InvalidTokenException(Kind kind) {
        super(kind.message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String getErrorCode() {
        return "INVALID_TOKEN";
    }

    @Override
    public int getHttpStatus() {
        return kind.httpStatus;
    }
}
