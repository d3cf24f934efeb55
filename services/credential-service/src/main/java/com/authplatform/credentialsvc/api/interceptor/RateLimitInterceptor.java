package com.authplatform.credentialsvc.api.interceptor;

import com.authplatform.credentialsvc.domain.ratelimit.RateLimitDecision;
import com.authplatform.credentialsvc.domain.ratelimit.RateLimitScope;
import com.authplatform.credentialsvc.domain.ratelimit.RateLimitService;
import com.authplatform.credentialsvc.shared.exception.RateLimitedException;
import com.authplatform.credentialsvc.shared.security.SecurityUtils;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Meters every API call by client address. Auth endpoints share the strict bucket,
 * everything else under {@code /api/} the general one.
 * A denial is raised as {@link RateLimitedException} and rendered by the exception handler.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimitInterceptor implements HandlerInterceptor {

    static final String AUTH_PATH_PREFIX = "/api/v1/auth/";

    public static final String LIMIT_HEADER = "RateLimit-Limit";
    public static final String REMAINING_HEADER = "RateLimit-Remaining";
    public static final String RESET_HEADER = "RateLimit-Reset";

    private final RateLimitService rateLimitService;
    private final SecurityUtils securityUtils;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        RateLimitScope scope = scopeFor(request.getRequestURI());
        String clientIp = securityUtils.resolveClientIp(request);

        RateLimitDecision decision = rateLimitService.checkRateLimit(scope, clientIp);
        if (decision.metered()) {
            response.setHeader(LIMIT_HEADER, String.valueOf(decision.limit()));
            response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));
            response.setHeader(RESET_HEADER, String.valueOf(decision.retryAfterSeconds()));
        }

        if (!decision.allowed()) {
            log.info("Request throttled: scope={}, path={}, ip={}",
                    scope, request.getRequestURI(), securityUtils.maskIp(clientIp));
            throw new RateLimitedException(decision.resetAfter());
        }
        return true;
    }

    static RateLimitScope scopeFor(String path) {
        return path != null && path.startsWith(AUTH_PATH_PREFIX) ? RateLimitScope.AUTH : RateLimitScope.GENERAL_API;
    }
}
