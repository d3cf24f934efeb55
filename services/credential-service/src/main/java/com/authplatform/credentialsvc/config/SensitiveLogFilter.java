package com.authplatform.credentialsvc.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;

import java.util.regex.Pattern;

/**
 * Logback filter that drops any event carrying credential material: raw 64-hex tokens,
 * or password/token key-value pairs. Wired from logback-spring.xml.
 */
public class SensitiveLogFilter extends Filter<ILoggingEvent> {

    private static final Pattern RAW_TOKEN = Pattern.compile("\\b[0-9a-fA-F]{64}\\b");

    private static final Pattern SECRET_ASSIGNMENT = Pattern.compile(
            "(?i)\"?(password|passwordHash|newPassword|refreshToken|sessionToken|resetToken|accessToken|authorization)\"?\\s*[=:]"
    );

    private static final Pattern BEARER = Pattern.compile("(?i)bearer\\s+[A-Za-z0-9._-]{16,}");

    @Override
    public FilterReply decide(ILoggingEvent event) {
        String message = event.getFormattedMessage();
        if (message == null) {
            return FilterReply.NEUTRAL;
        }
        return containsSecret(message) ? FilterReply.DENY : FilterReply.NEUTRAL;
    }

    public static boolean containsSecret(String message) {
        return RAW_TOKEN.matcher(message).find()
                || SECRET_ASSIGNMENT.matcher(message).find()
                || BEARER.matcher(message).find();
    }
}
