package com.authplatform.credentialsvc.api.support;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds the {@code refreshToken} cookie that carries the session token. It is HttpOnly,
 * SameSite=Strict and only sent to the auth endpoints.
 */
@Component
public class SessionCookieFactory {

    public static final String COOKIE_NAME = "refreshToken";
    public static final String COOKIE_PATH = "/api/v1/auth";

    private final boolean secure;
    private final Duration maxAge;

    public SessionCookieFactory(
            @Value("${app.session.cookie.secure:true}") boolean secure,
            @Value("${app.session.ttl-days:7}") long sessionTtlDays) {
        this.secure = secure;
        this.maxAge = Duration.ofDays(sessionTtlDays);
    }

    public ResponseCookie sessionCookie(String sessionToken) {
        return base(sessionToken).maxAge(maxAge).build();
    }

    public ResponseCookie clearedCookie() {
        return base("").maxAge(Duration.ZERO).build();
    }

    private ResponseCookie.ResponseCookieBuilder base(String value) {
        return ResponseCookie.from(COOKIE_NAME, value)
                .httpOnly(true)
                .secure(secure)
                .sameSite("Strict")
                .path(COOKIE_PATH);
    }
}
