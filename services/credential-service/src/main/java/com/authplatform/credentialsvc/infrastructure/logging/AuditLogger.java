package com.authplatform.credentialsvc.infrastructure.logging;

import com.authplatform.credentialsvc.shared.security.SecurityUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Writes audit and security events as single-line JSON under the {@code [AUDIT]} and
 * {@code [SECURITY]} markers, off the request thread. Log shipping picks them up from there.
 */
@Component
@Slf4j
public class AuditLogger {

    private static final String SERVICE_ID = "credential-service";

    private final SecurityUtils securityUtils;
    private final ObjectMapper objectMapper;

    public AuditLogger(SecurityUtils securityUtils, ObjectMapper objectMapper) {
        this.securityUtils = securityUtils;
        this.objectMapper = objectMapper;
    }

    public CompletableFuture<Void> logAudit(AuditEvent event) {
        Map<String, Object> entry = baseEntry("AUDIT", event.type().name(), event.type().description(),
                event.subjectOrNull(), event.correlationId(), event.occurredAt().toString());
        if (!event.details().isEmpty()) {
            entry.put("metadata", event.details());
        }
        return CompletableFuture.runAsync(() -> write("AUDIT", entry));
    }

    public CompletableFuture<Void> logSecurity(SecurityEvent event) {
        Map<String, Object> entry = baseEntry("SECURITY", event.type().name(), event.reason(),
                event.subjectOrNull(), event.correlationId(), event.occurredAt().toString());
        Map<String, String> metadata = new LinkedHashMap<>(event.details());
        if (event.clientIp() != null) {
            metadata.put("maskedIp", securityUtils.maskIp(event.clientIp()));
        }
        if (event.email() != null) {
            metadata.put("maskedEmail", securityUtils.maskEmail(event.email()));
        }
        if (!metadata.isEmpty()) {
            entry.put("metadata", metadata);
        }
        return CompletableFuture.runAsync(() -> write("SECURITY", entry));
    }

    private Map<String, Object> baseEntry(String level, String eventType, String description,
                                          String userId, String correlationId, String timestamp) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("level", level);
        entry.put("eventType", eventType);
        entry.put("description", description);
        entry.put("serviceId", SERVICE_ID);
        entry.put("correlationId", correlationId);
        entry.put("timestamp", timestamp);
        if (userId != null) {
            entry.put("userId", userId);
        }
        return entry;
    }

    private void write(String level, Map<String, Object> entry) {
        try {
            String json = objectMapper.writeValueAsString(entry);
            if ("SECURITY".equals(level)) {
                log.warn("[SECURITY] {}", json);
            } else {
                log.info("[AUDIT] {}", json);
            }
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} event {}: {}", level, entry.get("eventType"), e.getMessage());
        }
    }
}
