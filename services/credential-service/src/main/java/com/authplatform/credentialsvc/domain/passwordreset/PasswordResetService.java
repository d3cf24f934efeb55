package com.authplatform.credentialsvc.domain.passwordreset;

import com.authplatform.credentialsvc.config.CredentialMetrics;
import com.authplatform.credentialsvc.domain.model.PasswordResetToken;
import com.authplatform.credentialsvc.domain.model.User;
import com.authplatform.credentialsvc.infra.persistence.PasswordResetTokenRepository;
import com.authplatform.credentialsvc.infra.persistence.SessionTokenRepository;
import com.authplatform.credentialsvc.infra.persistence.UserRepository;
import com.authplatform.credentialsvc.infrastructure.logging.AuditEvent;
import com.authplatform.credentialsvc.infrastructure.logging.AuditLogger;
import com.authplatform.credentialsvc.infrastructure.notification.NotificationGateway;
import com.authplatform.credentialsvc.shared.crypto.PasswordService;
import com.authplatform.credentialsvc.shared.crypto.TokenHasher;
import com.authplatform.credentialsvc.shared.exception.InvalidTokenException;
import com.authplatform.credentialsvc.shared.exception.ValidationException;
import com.authplatform.credentialsvc.shared.security.SecurityUtils;
import com.authplatform.credentialsvc.shared.validation.FieldError;
import com.authplatform.credentialsvc.shared.validation.ValidationResult;
import com.authplatform.credentialsvc.shared.validation.ValidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Single-use password reset tokens.
 *
 * <p>Requesting a reset for an unknown address is a silent no-op. Consuming a token updates the
 * password hash, deletes the token and (by default) revokes every session of the user in one
 * transaction.
 */
@Service
@Slf4j
public class PasswordResetService {

    private final PasswordResetTokenRepository resetTokenRepository;
    private final UserRepository userRepository;
    private final SessionTokenRepository sessionTokenRepository;
    private final NotificationGateway notificationGateway;
    private final TokenHasher tokenHasher;
    private final PasswordService passwordService;
    private final ValidationService validationService;
    private final AuditLogger auditLogger;
    private final SecurityUtils securityUtils;
    private final CredentialMetrics metrics;
    private final Clock clock;
    private final Duration tokenTtl;
    private final boolean revokeSessions;

    public PasswordResetService(
            PasswordResetTokenRepository resetTokenRepository,
            UserRepository userRepository,
            SessionTokenRepository sessionTokenRepository,
            NotificationGateway notificationGateway,
            TokenHasher tokenHasher,
            PasswordService passwordService,
            ValidationService validationService,
            AuditLogger auditLogger,
            SecurityUtils securityUtils,
            CredentialMetrics metrics,
            Clock clock,
            @Value("${app.password-reset.ttl-minutes:10}") long tokenTtlMinutes,
            @Value("${app.password-reset.revoke-sessions:true}") boolean revokeSessions) {
        this.resetTokenRepository = resetTokenRepository;
        this.userRepository = userRepository;
        this.sessionTokenRepository = sessionTokenRepository;
        this.notificationGateway = notificationGateway;
        this.tokenHasher = tokenHasher;
        this.passwordService = passwordService;
        this.validationService = validationService;
        this.auditLogger = auditLogger;
        this.securityUtils = securityUtils;
        this.metrics = metrics;
        this.clock = clock;
        this.tokenTtl = Duration.ofMinutes(tokenTtlMinutes);
        this.revokeSessions = revokeSessions;
    }

    @Transactional
    public void requestPasswordReset(String email) {
        String normalizedEmail = validationService.normalizeEmail(email);
        Optional<User> userOpt = normalizedEmail == null || normalizedEmail.isEmpty()
                ? Optional.empty()
                : userRepository.findByEmail(normalizedEmail);

        if (userOpt.isEmpty()) {
            log.debug("Password reset requested for unknown address: email={}",
                    securityUtils.maskEmail(normalizedEmail));
            return;
        }

        User user = userOpt.get();
        Instant now = clock.instant();
        String token = tokenHasher.generateToken();
        resetTokenRepository.save(PasswordResetToken.builder()
                .tokenHash(tokenHasher.hash(token))
                .userId(user.getId())
                .expiresAt(now.plus(tokenTtl))
                .createdAt(now)
                .build());

        notificationGateway.sendPasswordResetLink(user.getId(), normalizedEmail, token);
        metrics.passwordResetRequested();

        auditLogger.logAudit(AuditEvent.of(AuditEvent.Type.PASSWORD_RESET_REQUESTED, user.getId(),
                securityUtils.getCurrentCorrelationId(), Map.of("email", securityUtils.maskEmail(normalizedEmail))));
    }

    /**
     * @throws ValidationException if the new password is too weak
     * @throws InvalidTokenException if the token is unknown, expired or already used
     */
    @Transactional(noRollbackFor = InvalidTokenException.class)
    public void consumePasswordReset(String token, String newPassword) {
        ValidationResult passwordCheck = validationService.validatePassword(newPassword);
        if (!passwordCheck.valid()) {
            // field name on the wire is newPassword
            throw new ValidationException(passwordCheck.errors().stream()
                    .map(e -> FieldError.of("newPassword", e.code(), e.message()))
                    .collect(Collectors.toList()));
        }
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException(InvalidTokenException.Kind.PASSWORD_RESET_TOKEN);
        }
        Instant now = clock.instant();

        PasswordResetToken row = resetTokenRepository.findByTokenHash(tokenHasher.hash(token))
                .orElseThrow(() -> new InvalidTokenException(InvalidTokenException.Kind.PASSWORD_RESET_TOKEN));

        if (row.isExpired(now)) {
            resetTokenRepository.deleteRowById(row.getId());
            throw new InvalidTokenException(InvalidTokenException.Kind.PASSWORD_RESET_TOKEN);
        }
        if (resetTokenRepository.deleteRowById(row.getId()) != 1) {
            throw new InvalidTokenException(InvalidTokenException.Kind.PASSWORD_RESET_TOKEN);
        }

        userRepository.updatePasswordHash(row.getUserId(), passwordService.hash(newPassword), now);

        int revoked = revokeSessions ? sessionTokenRepository.deleteAllByUserId(row.getUserId()) : 0;
        metrics.passwordResetCompleted();

        auditLogger.logAudit(AuditEvent.of(AuditEvent.Type.PASSWORD_RESET_COMPLETED, row.getUserId(),
                securityUtils.getCurrentCorrelationId(), Map.of("sessionsRevoked", String.valueOf(revoked))));
        log.info("Password reset completed: userId={}, sessionsRevoked={}", row.getUserId(), revoked);
    }
}
