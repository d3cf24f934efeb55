package com.authplatform.credentialsvc.api.filter;

import com.authplatform.credentialsvc.shared.security.SecurityUtils;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Puts the correlation id and masked client address into the MDC for the whole request
 * and echoes the id back in the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private final SecurityUtils securityUtils;

    public CorrelationIdFilter(SecurityUtils securityUtils) {
        this.securityUtils = securityUtils;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        try {
            String correlationId = securityUtils.getOrCreateCorrelationId(request.getHeader(CORRELATION_ID_HEADER));
            securityUtils.setMdcContext(correlationId, securityUtils.resolveClientIp(request));
            response.setHeader(CORRELATION_ID_HEADER, correlationId);

            filterChain.doFilter(request, response);
        } finally {
            securityUtils.clearMdcContext();
        }
    }
}
