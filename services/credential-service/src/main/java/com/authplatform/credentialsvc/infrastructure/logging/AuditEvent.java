package com.authplatform.credentialsvc.infrastructure.logging;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Credential lifecycle fact worth keeping. Details must already be masked; raw tokens and codes
 * never go here.
 */
public record AuditEvent(
        Type type,
        UUID subject,
        String correlationId,
        Map<String, String> details,
        Instant occurredAt
) {

    public enum Type {
        USER_REGISTERED("User registered"),
        VERIFICATION_CODE_ISSUED("Verification code issued"),
        EMAIL_VERIFIED("Email verified with code"),
        RESEND_REQUESTED("Resend verification requested"),
        SESSION_ISSUED("Session issued"),
        SESSIONS_REVOKED("All sessions revoked"),
        PASSWORD_RESET_REQUESTED("Password reset token issued"),
        PASSWORD_RESET_COMPLETED("Password changed with reset token");

        private final String description;

        Type(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    public AuditEvent {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static AuditEvent of(Type type, UUID subject, String correlationId) {
        return new AuditEvent(type, subject, correlationId, Map.of(), Instant.now());
    }

    public static AuditEvent of(Type type, UUID subject, String correlationId, Map<String, String> details) {
        return new AuditEvent(type, subject, correlationId, details, Instant.now());
    }

    /** Subject as written to the log line; anonymous events (resend) have none. */
    public String subjectOrNull() {
        return subject == null ? null : subject.toString();
    }
}
