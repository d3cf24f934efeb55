package com.authplatform.credentialsvc.shared.validation;

import com.authplatform.credentialsvc.shared.exception.ValidationException;

import java.util.List;

public record ValidationResult(boolean valid, List<FieldError> errors) {

    public static ValidationResult success() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult failure(List<FieldError> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    public static ValidationResult failure(FieldError error) {
        return new ValidationResult(false, List.of(error));
    }

    /**
     * Throws {@link ValidationException} carrying every collected error when invalid.
     */
    public void throwIfInvalid() {
        if (!valid) {
            throw new ValidationException(errors);
        }
    }
}
