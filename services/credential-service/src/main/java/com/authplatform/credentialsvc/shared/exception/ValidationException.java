package com.authplatform.credentialsvc.shared.exception;

import com.authplatform.credentialsvc.shared.validation.FieldError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Input rejected before any state changed. The message names the offending fields only;
 * rejected values never appear in it.
 */
public final class ValidationException extends CredentialServiceException {

    private final List<FieldError> errors;

    public ValidationException(List<FieldError> errors) {
        super(describe(errors));
        this.errors = List.copyOf(errors);
    }

    public ValidationException(FieldError error) {
        this(List.of(error));
    }

    private static String describe(List<FieldError> errors) {
        return errors.stream()
                .map(FieldError::field)
                .distinct()
                .collect(Collectors.joining(", ", "Invalid input: ", ""));
    }

    public List<FieldError> getErrors() {
        return errors;
    }

    public boolean rejects(String field) {
        return errors.stream().anyMatch(error -> error.field().equals(field));
    }

    @Override
    public String getErrorCode() {
        return "VALIDATION_ERROR";
    }

    @Override
    public int getHttpStatus() {
        return 400;
    }
}
