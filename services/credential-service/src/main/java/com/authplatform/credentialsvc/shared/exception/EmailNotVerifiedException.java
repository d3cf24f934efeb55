package com.authplatform.credentialsvc.shared.exception;

public final class EmailNotVerifiedException extends CredentialServiceException {

    public EmailNotVerifiedException() {
        super("Please verify your email with the 6-digit code sent to your inbox");
    }

    @Override
    public String getErrorCode() {
        return "EMAIL_NOT_VERIFIED";
    }

    @Override
    public int getHttpStatus() {
        return 403;
    }
}
