package com.authplatform.credentialsvc.infrastructure.logging;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Suspicious or defensive event. Client address and email are masked by {@link AuditLogger}
 * before anything is written.
 */
public record SecurityEvent(
        Type type,
        UUID subject,
        String clientIp,
        String email,
        String correlationId,
        String reason,
        Map<String, String> details,
        Instant occurredAt
) {

    public enum Type {
        LOGIN_FAILED,
        SESSION_TOKEN_REUSE
    }

    public SecurityEvent {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    /** Subject is null when the email matched no account. */
    public static SecurityEvent loginFailed(UUID subject, String clientIp, String email,
                                            String correlationId, String reason) {
        return new SecurityEvent(Type.LOGIN_FAILED, subject, clientIp, email, correlationId,
                "Login failed: " + reason, Map.of(), Instant.now());
    }

    public static SecurityEvent sessionReuse(UUID subject, String correlationId, Map<String, String> details) {
        return new SecurityEvent(Type.SESSION_TOKEN_REUSE, subject, null, null, correlationId,
                "Previously rotated session token was presented again", details, Instant.now());
    }

    public String subjectOrNull() {
        return subject == null ? null : subject.toString();
    }
}
