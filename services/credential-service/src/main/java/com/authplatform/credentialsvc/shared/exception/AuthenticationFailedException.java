package com.authplatform.credentialsvc.shared.exception;

public final class AuthenticationFailedException extends CredentialServiceException {

    private final boolean socialAccount;

    private AuthenticationFailedException(String message, boolean socialAccount) {
        super(message);
        this.socialAccount = socialAccount;
    }

    public static AuthenticationFailedException badCredentials() {
        return new AuthenticationFailedException("Invalid email or password", false);
    }

    public static AuthenticationFailedException socialAccount() {
        return new AuthenticationFailedException(
                "This account was registered through a social provider. Please use social login.", true);
    }

    public boolean isSocialAccount() {
        return socialAccount;
    }

    @Override
    public String getErrorCode() {
        return socialAccount ? "SOCIAL_LOGIN_REQUIRED" : "AUTHENTICATION_FAILED";
    }

    @Override
    public int getHttpStatus() {
        return 401;
    }
}
