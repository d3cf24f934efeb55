package com.authplatform.credentialsvc.shared.security;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Masking, client address resolution and MDC bookkeeping shared by the web and domain layers.
 */
@Component
public class SecurityUtils {

    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String USER_ID_KEY = "userId";
    public static final String CLIENT_IP_KEY = "clientIp";

    private static final Pattern IPV4_PATTERN = Pattern.compile("^(\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})\\.\\d{1,3}$");
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^(.{2})([^@]*)(@.+)$");

    /**
     * Masks an IPv4 address by replacing the last octet with ***.
     * Example: 192.168.1.100 -> 192.168.1.***
     */
    public String maskIp(String ip) {
        if (ip == null || ip.isBlank()) {
            return "***";
        }
        var matcher = IPV4_PATTERN.matcher(ip.trim());
        if (matcher.matches()) {
            return matcher.group(1) + ".***";
        }
        // IPv6 or unparseable: keep only a short prefix
        return ip.length() > 6 ? ip.substring(0, 6) + "***" : "***";
    }

    /**
     * Keeps the first 2 characters of the local part.
     * Example: john.doe@example.com -> jo***@example.com
     */
    public String maskEmail(String email) {
        if (email == null || email.isBlank()) {
            return "***";
        }
        var matcher = EMAIL_PATTERN.matcher(email.trim().toLowerCase(Locale.ROOT));
        if (matcher.matches()) {
            return matcher.group(1) + "***" + matcher.group(3);
        }
        return email.length() > 2 ? email.substring(0, 2) + "***" : "***";
    }

    /**
     * First hop of X-Forwarded-For, then X-Real-IP, then the socket address.
     */
    public String resolveClientIp(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            return xForwardedFor.split(",")[0].trim();
        }
        String xRealIp = request.getHeader("X-Real-IP");
        if (xRealIp != null && !xRealIp.isBlank()) {
            return xRealIp.trim();
        }
        return request.getRemoteAddr();
    }

    public String getOrCreateCorrelationId(String provided) {
        if (provided != null && !provided.isBlank()) {
            return provided.trim();
        }
        return UUID.randomUUID().toString();
    }

    public void setMdcContext(String correlationId, String clientIp) {
        if (correlationId != null) {
            MDC.put(CORRELATION_ID_KEY, correlationId);
        }
        if (clientIp != null) {
            MDC.put(CLIENT_IP_KEY, maskIp(clientIp));
        }
    }

    public void setMdcUser(String userId) {
        if (userId != null) {
            MDC.put(USER_ID_KEY, userId);
        }
    }

    public void clearMdcContext() {
        MDC.remove(CORRELATION_ID_KEY);
        MDC.remove(USER_ID_KEY);
        MDC.remove(CLIENT_IP_KEY);
    }

    public String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY);
    }
}
