package com.authplatform.credentialsvc.api.error;

import com.authplatform.credentialsvc.shared.exception.ConflictException;
import com.authplatform.credentialsvc.shared.exception.CredentialServiceException;
import com.authplatform.credentialsvc.shared.exception.RateLimitedException;
import com.authplatform.credentialsvc.shared.exception.ValidationException;
import com.authplatform.credentialsvc.shared.security.SecurityUtils;
import com.authplatform.credentialsvc.shared.validation.FieldError;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps exceptions to RFC 7807 problem responses carrying the request's correlation id.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String VALIDATION_ERROR = "VALIDATION_ERROR";

    private final SecurityUtils securityUtils;

    public GlobalExceptionHandler(SecurityUtils securityUtils) {
        this.securityUtils = securityUtils;
    }

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ProblemDetail> handleRateLimited(RateLimitedException ex, HttpServletRequest request) {
        String correlationId = securityUtils.getCurrentCorrelationId();

        ProblemDetail problem = ProblemDetail.of(
                ex.getErrorCode(),
                "Rate Limit Exceeded",
                ex.getHttpStatus(),
                "Too many requests. Please try again later.",
                request.getRequestURI(),
                correlationId,
                Map.of("retryAfter", ex.getRetryAfterSeconds())
        );

        log.warn("Rate limit exceeded: correlationId={}, retryAfter={}s", correlationId, ex.getRetryAfterSeconds());

        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(problem);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidation(ValidationException ex, HttpServletRequest request) {
        log.debug("Validation error: correlationId={}, errors={}",
                securityUtils.getCurrentCorrelationId(), ex.getErrors());
        return validationProblem(ex.getErrors(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleInvalidBody(MethodArgumentNotValidException ex,
                                                           HttpServletRequest request) {
        List<FieldError> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> FieldError.of(e.getField(), "INVALID", e.getDefaultMessage()))
                .toList();
        return validationProblem(errors, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                              HttpServletRequest request) {
        return validationProblem(List.of(FieldError.of("body", "MALFORMED", "Request body is missing or malformed")),
                request);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ProblemDetail> handleConflict(ConflictException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetail.of(
                ex.getErrorCode(),
                "Conflict",
                ex.getHttpStatus(),
                ex.getMessage(),
                request.getRequestURI(),
                securityUtils.getCurrentCorrelationId(),
                Map.of("field", ex.getField())
        );
        return ResponseEntity.status(ex.getHttpStatus()).body(problem);
    }

    @ExceptionHandler(CredentialServiceException.class)
    public ResponseEntity<ProblemDetail> handleCredentialError(CredentialServiceException ex,
                                                               HttpServletRequest request) {
        String correlationId = securityUtils.getCurrentCorrelationId();

        ProblemDetail problem = ProblemDetail.of(
                ex.getErrorCode(),
                toTitle(ex.getErrorCode()),
                ex.getHttpStatus(),
                ex.getMessage(),
                request.getRequestURI(),
                correlationId
        );

        log.debug("Handled exception: type={}, correlationId={}", ex.getErrorCode(), correlationId);
        return ResponseEntity.status(ex.getHttpStatus()).body(problem);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ProblemDetail> handleDataAccess(DataAccessException ex, HttpServletRequest request) {
        String correlationId = securityUtils.getCurrentCorrelationId();
        log.error("Credential store failure: correlationId={}, path={}", correlationId, request.getRequestURI(), ex);
        return internalError(request, correlationId);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGeneric(Exception ex, HttpServletRequest request) {
        String correlationId = securityUtils.getCurrentCorrelationId();
        log.error("Unexpected error: correlationId={}", correlationId, ex);
        return internalError(request, correlationId);
    }

    private ResponseEntity<ProblemDetail> validationProblem(List<FieldError> errors, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetail.of(
                VALIDATION_ERROR,
                "Validation Error",
                HttpStatus.BAD_REQUEST.value(),
                "One or more validation errors occurred",
                request.getRequestURI(),
                securityUtils.getCurrentCorrelationId(),
                Map.of("errors", errors)
        );
        return ResponseEntity.badRequest().body(problem);
    }

    private ResponseEntity<ProblemDetail> internalError(HttpServletRequest request, String correlationId) {
        ProblemDetail problem = ProblemDetail.of(
                "INTERNAL_ERROR",
                "Internal Server Error",
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "An unexpected error occurred",
                request.getRequestURI(),
                correlationId
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    private static String toTitle(String errorCode) {
        String words = errorCode.replace('_', ' ').toLowerCase(Locale.ROOT);
        return Character.toUpperCase(words.charAt(0)) + words.substring(1);
    }
}
