package com.authplatform.credentialsvc.domain.verification;

import com.authplatform.credentialsvc.config.CredentialMetrics;
import com.authplatform.credentialsvc.domain.model.VerificationCode;
import com.authplatform.credentialsvc.infra.persistence.UserRepository;
import com.authplatform.credentialsvc.infra.persistence.VerificationCodeRepository;
import com.authplatform.credentialsvc.infrastructure.logging.AuditEvent;
import com.authplatform.credentialsvc.infrastructure.logging.AuditLogger;
import com.authplatform.credentialsvc.infrastructure.notification.NotificationGateway;
import com.authplatform.credentialsvc.shared.crypto.TokenHasher;
import com.authplatform.credentialsvc.shared.exception.InvalidTokenException;
import com.authplatform.credentialsvc.shared.exception.RateLimitedException;
import com.authplatform.credentialsvc.shared.security.SecurityUtils;
import com.authplatform.credentialsvc.shared.validation.ValidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Proof of email ownership through short-lived 6-digit codes.
 *
 * <p>Issuing is limited per email address by counting the code rows created in the trailing
 * window, so the limit holds across instances without a separate counter. Consuming deletes the
 * row with a conditional delete in the same transaction that marks the user verified.
 */
@Service
@Slf4j
public class VerificationCodeService {

    static final int CODE_DIGITS = 6;

    private final VerificationCodeRepository codeRepository;
    private final UserRepository userRepository;
    private final NotificationGateway notificationGateway;
    private final TokenHasher tokenHasher;
    private final ValidationService validationService;
    private final AuditLogger auditLogger;
    private final SecurityUtils securityUtils;
    private final CredentialMetrics metrics;
    private final Clock clock;
    private final Duration codeTtl;
    private final int maxIssuesPerWindow;
    private final Duration issueWindow;

    public VerificationCodeService(
            VerificationCodeRepository codeRepository,
            UserRepository userRepository,
            NotificationGateway notificationGateway,
            TokenHasher tokenHasher,
            ValidationService validationService,
            AuditLogger auditLogger,
            SecurityUtils securityUtils,
            CredentialMetrics metrics,
            Clock clock,
            @Value("${app.verification-code.ttl-minutes:5}") long codeTtlMinutes,
            @Value("${app.verification-code.max-per-window:3}") int maxIssuesPerWindow,
            @Value("${app.verification-code.window-minutes:60}") long issueWindowMinutes) {
        this.codeRepository = codeRepository;
        this.userRepository = userRepository;
        this.notificationGateway = notificationGateway;
        this.tokenHasher = tokenHasher;
        this.validationService = validationService;
        this.auditLogger = auditLogger;
        this.securityUtils = securityUtils;
        this.metrics = metrics;
        this.clock = clock;
        this.codeTtl = Duration.ofMinutes(codeTtlMinutes);
        this.maxIssuesPerWindow = maxIssuesPerWindow;
        this.issueWindow = Duration.ofMinutes(issueWindowMinutes);
    }

    /**
     * Creates a code for the address and enqueues it for delivery.
     *
     * @return the raw code, for callers that need it beyond the notification (tests, tooling)
     * @throws RateLimitedException when the address already received the maximum number of
     *         codes in the trailing window; no row is created in that case
     */
    @Transactional
    public String issueVerificationCode(UUID userId, String email) {
        String normalizedEmail = validationService.normalizeEmail(email);
        Instant now = clock.instant();
        Instant windowStart = now.minus(issueWindow);

        long issued = codeRepository.countIssuedSince(normalizedEmail, windowStart);
        if (issued >= maxIssuesPerWindow) {
            Instant oldest = codeRepository.findOldestIssuedSince(normalizedEmail, windowStart).orElse(now);
            Duration retryAfter = Duration.between(now, oldest.plus(issueWindow));
            log.info("Verification code limit reached: email={}, issued={}",
                    securityUtils.maskEmail(normalizedEmail), issued);
            throw new RateLimitedException(retryAfter.isNegative() ? Duration.ZERO : retryAfter);
        }

        String code = tokenHasher.generateNumericCode(CODE_DIGITS);
        codeRepository.save(VerificationCode.builder()
                .userId(userId)
                .email(normalizedEmail)
                .codeHash(tokenHasher.hash(code))
                .expiresAt(now.plus(codeTtl))
                .createdAt(now)
                .build());

        notificationGateway.sendVerificationCode(userId, normalizedEmail, code);
        metrics.verificationCodeIssued();

        auditLogger.logAudit(AuditEvent.of(AuditEvent.Type.VERIFICATION_CODE_ISSUED, userId,
                securityUtils.getCurrentCorrelationId(), Map.of("email", securityUtils.maskEmail(normalizedEmail))));
        return code;
    }

    /**
     * Marks the address verified if the code matches a live row, consuming the row.
     *
     * @return id of the verified user
     * @throws com.authplatform.credentialsvc.shared.exception.ValidationException if the code is not 6 digits
     * @throws InvalidTokenException if no live row matches or a concurrent consumer won
     */
    @Transactional(noRollbackFor = InvalidTokenException.class)
    public UUID consumeVerificationCode(String email, String code) {
        validationService.validateVerificationCode(code).throwIfInvalid();
        String normalizedEmail = validationService.normalizeEmail(email);
        if (normalizedEmail == null || normalizedEmail.isEmpty()) {
            throw new InvalidTokenException(InvalidTokenException.Kind.VERIFICATION_CODE);
        }
        Instant now = clock.instant();

        VerificationCode row = codeRepository.findFirstByEmailAndCodeHash(normalizedEmail, tokenHasher.hash(code))
                .orElseThrow(() -> new InvalidTokenException(InvalidTokenException.Kind.VERIFICATION_CODE));

        if (row.isExpired(now)) {
            codeRepository.deleteRowById(row.getId());
            throw new InvalidTokenException(InvalidTokenException.Kind.VERIFICATION_CODE);
        }

        if (codeRepository.deleteRowById(row.getId()) != 1) {
            log.info("Verification code consumed concurrently: userId={}", row.getUserId());
            throw new InvalidTokenException(InvalidTokenException.Kind.VERIFICATION_CODE);
        }

        userRepository.markEmailVerified(row.getUserId(), now);
        metrics.verificationCodeConsumed();

        auditLogger.logAudit(AuditEvent.of(AuditEvent.Type.EMAIL_VERIFIED, row.getUserId(),
                securityUtils.getCurrentCorrelationId(), Map.of("email", securityUtils.maskEmail(normalizedEmail))));
        return row.getUserId();
    }
}
