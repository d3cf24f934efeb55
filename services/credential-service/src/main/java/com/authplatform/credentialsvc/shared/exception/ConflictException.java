package com.authplatform.credentialsvc.shared.exception;

public final class ConflictException extends CredentialServiceException {

    private final String field;

    public ConflictException(String field, String message) {
        super(message);
        this.field = field;
    }

    public static ConflictException emailTaken() {
        return new ConflictException("email", "Email already registered");
    }

    public static ConflictException displayNameTaken() {
        return new ConflictException("displayName", "Display name already taken");
    }

    public String getField() {
        return field;
    }

    @Override
    public String getErrorCode() {
        return "CONFLICT";
    }

    @Override
    public int getHttpStatus() {
        return 409;
    }
}
