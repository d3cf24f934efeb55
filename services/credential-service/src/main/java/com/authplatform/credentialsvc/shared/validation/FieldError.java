package com.authplatform.credentialsvc.shared.validation;

/**
 * Field-level validation failure, serialized into problem responses.
 */
public record FieldError(String field, String code, String message) {

    public static FieldError of(String field, String code, String message) {
        return new FieldError(field, code, message);
    }
}
