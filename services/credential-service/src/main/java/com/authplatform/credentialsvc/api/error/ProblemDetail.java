package com.authplatform.credentialsvc.api.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * RFC 7807 problem body. Extensions carry per-error extras such as field errors or retry-after.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ProblemDetail(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        Instant timestamp,
        String correlationId,
        String errorCode,
        Map<String, Object> extensions
) {
    public static final String TYPE_BASE = "https://api.auth-platform.com/problems/";

    public static ProblemDetail of(
            String errorCode, String title, int status, String detail,
            String instance, String correlationId) {
        return of(errorCode, title, status, detail, instance, correlationId, Map.of());
    }

    public static ProblemDetail of(
            String errorCode, String title, int status, String detail,
            String instance, String correlationId, Map<String, Object> extensions) {
        return new ProblemDetail(TYPE_BASE + errorCode.toLowerCase().replace('_', '-'), title, status, detail,
                instance, Instant.now(), correlationId, errorCode, extensions);
    }
}
