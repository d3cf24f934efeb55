package com.authplatform.credentialsvc.shared.validation;

import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Input validation for credential flows.
 * Single source of truth for email, password, display name and code formats.
 */
@Service
public class ValidationService {

    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$"
    );

    private static final Pattern VERIFICATION_CODE_PATTERN = Pattern.compile("^\\d{6}$");

    private static final Pattern SCRIPT_PATTERN = Pattern.compile(
            "<script[^>]*>.*?</script>|javascript:|on\\w+\\s*=",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );

    private static final String PASSWORD_SPECIALS = "@$!%*#?&";

    private static final int EMAIL_MAX_LENGTH = 255;
    private static final int PASSWORD_MIN_LENGTH = 8;
    private static final int PASSWORD_MAX_LENGTH = 128;
    private static final int DISPLAY_NAME_MIN_LENGTH = 2;
    private static final int DISPLAY_NAME_MAX_LENGTH = 50;

    public ValidationResult validateEmail(String email) {
        if (email == null || email.isBlank()) {
            return ValidationResult.failure(FieldError.of("email", "REQUIRED", "Email is required"));
        }
        String normalized = normalizeEmail(email);
        if (normalized.length() > EMAIL_MAX_LENGTH || !EMAIL_PATTERN.matcher(normalized).matches()) {
            return ValidationResult.failure(FieldError.of("email", "INVALID_FORMAT", "Invalid email format"));
        }
        return ValidationResult.success();
    }

    /**
     * Password must be 8-128 characters with at least one letter, one digit and one of {@value #PASSWORD_SPECIALS}.
     */
    public ValidationResult validatePassword(String password) {
        if (password == null || password.isEmpty()) {
            return ValidationResult.failure(FieldError.of("password", "REQUIRED", "Password is required"));
        }

        List<FieldError> errors = new ArrayList<>();

        if (password.length() < PASSWORD_MIN_LENGTH) {
            errors.add(FieldError.of("password", "TOO_SHORT",
                    "Password must be at least " + PASSWORD_MIN_LENGTH + " characters"));
        }
        if (password.length() > PASSWORD_MAX_LENGTH) {
            errors.add(FieldError.of("password", "TOO_LONG",
                    "Password must not exceed " + PASSWORD_MAX_LENGTH + " characters"));
        }
        if (password.chars().noneMatch(Character::isLetter)) {
            errors.add(FieldError.of("password", "MISSING_LETTER", "Password must contain a letter"));
        }
        if (password.chars().noneMatch(Character::isDigit)) {
            errors.add(FieldError.of("password", "MISSING_DIGIT", "Password must contain a digit"));
        }
        if (password.chars().noneMatch(c -> PASSWORD_SPECIALS.indexOf(c) >= 0)) {
            errors.add(FieldError.of("password", "MISSING_SPECIAL",
                    "Password must contain one of " + PASSWORD_SPECIALS));
        }

        return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
    }

    /**
     * Rejects passwords that embed the email local part or the display name.
     */
    public ValidationResult validatePasswordNotPersonal(String password, String email, String displayName) {
        if (password == null) {
            return ValidationResult.success();
        }
        String lowerPassword = password.toLowerCase(Locale.ROOT);
        if (email != null && email.contains("@")) {
            String localPart = email.substring(0, email.indexOf('@')).toLowerCase(Locale.ROOT);
            if (!localPart.isEmpty() && lowerPassword.contains(localPart)) {
                return ValidationResult.failure(FieldError.of("password", "CONTAINS_EMAIL",
                        "Password must not contain your email ID"));
            }
        }
        if (displayName != null && !displayName.isBlank()
                && lowerPassword.contains(displayName.trim().toLowerCase(Locale.ROOT))) {
            return ValidationResult.failure(FieldError.of("password", "CONTAINS_DISPLAY_NAME",
                    "Password must not contain your display name"));
        }
        return ValidationResult.success();
    }

    /**
     * Display name is optional; when present it is length-limited and free of script content.
     */
    public ValidationResult validateDisplayName(String displayName) {
        if (displayName == null) {
            return ValidationResult.success();
        }

        String trimmed = displayName.trim();
        List<FieldError> errors = new ArrayList<>();

        if (trimmed.length() < DISPLAY_NAME_MIN_LENGTH) {
            errors.add(FieldError.of("displayName", "TOO_SHORT",
                    "Display name must be at least " + DISPLAY_NAME_MIN_LENGTH + " characters"));
        }
        if (trimmed.length() > DISPLAY_NAME_MAX_LENGTH) {
            errors.add(FieldError.of("displayName", "TOO_LONG",
                    "Display name must not exceed " + DISPLAY_NAME_MAX_LENGTH + " characters"));
        }
        if (SCRIPT_PATTERN.matcher(trimmed).find()) {
            errors.add(FieldError.of("displayName", "INVALID_CONTENT", "Display name contains invalid content"));
        }

        return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
    }

    public ValidationResult validateVerificationCode(String code) {
        if (code == null || !VERIFICATION_CODE_PATTERN.matcher(code).matches()) {
            return ValidationResult.failure(FieldError.of("code", "INVALID_FORMAT",
                    "Verification code must be exactly 6 digits"));
        }
        return ValidationResult.success();
    }

    public String sanitizeDisplayName(String displayName) {
        if (displayName == null) return null;
        return HtmlUtils.htmlEscape(displayName.trim());
    }

    public String normalizeEmail(String email) {
        if (email == null) return null;
        return email.trim().toLowerCase(Locale.ROOT);
    }

    public ValidationResult validateRegistration(String email, String password, String displayName) {
        List<FieldError> allErrors = new ArrayList<>();

        allErrors.addAll(validateEmail(email).errors());
        allErrors.addAll(validatePassword(password).errors());
        allErrors.addAll(validateDisplayName(displayName).errors());
        if (allErrors.isEmpty()) {
            allErrors.addAll(validatePasswordNotPersonal(password, normalizeEmail(email), displayName).errors());
        }

        return allErrors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(allErrors);
    }
}
