package com.authplatform.credentialsvc.domain.registration;

import com.authplatform.credentialsvc.domain.model.User;
import com.authplatform.credentialsvc.domain.verification.VerificationCodeService;
import com.authplatform.credentialsvc.infra.persistence.UserRepository;
import com.authplatform.credentialsvc.infrastructure.logging.AuditEvent;
import com.authplatform.credentialsvc.infrastructure.logging.AuditLogger;
import com.authplatform.credentialsvc.shared.crypto.PasswordService;
import com.authplatform.credentialsvc.shared.exception.ConflictException;
import com.authplatform.credentialsvc.shared.security.SecurityUtils;
import com.authplatform.credentialsvc.shared.validation.ValidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Creates an unverified account and sends its first verification code.
 */
@Service
@Slf4j
public class RegistrationService {

    private static final String DISPLAY_NAME_CONSTRAINT = "uk_users_display_name";

    private final UserRepository userRepository;
    private final ValidationService validationService;
    private final PasswordService passwordService;
    private final VerificationCodeService verificationCodeService;
    private final AuditLogger auditLogger;
    private final SecurityUtils securityUtils;
    private final Clock clock;

    public RegistrationService(
            UserRepository userRepository,
            ValidationService validationService,
            PasswordService passwordService,
            VerificationCodeService verificationCodeService,
            AuditLogger auditLogger,
            SecurityUtils securityUtils,
            Clock clock) {
        this.userRepository = userRepository;
        this.validationService = validationService;
        this.passwordService = passwordService;
        this.verificationCodeService = verificationCodeService;
        this.auditLogger = auditLogger;
        this.securityUtils = securityUtils;
        this.clock = clock;
    }

    @Transactional
    public RegistrationResult register(String email, String password, String displayName) {
        validationService.validateRegistration(email, password, displayName).throwIfInvalid();

        String normalizedEmail = validationService.normalizeEmail(email);
        String sanitizedDisplayName = validationService.sanitizeDisplayName(displayName);

        if (userRepository.existsByEmail(normalizedEmail)) {
            throw ConflictException.emailTaken();
        }
        if (sanitizedDisplayName != null && userRepository.existsByDisplayName(sanitizedDisplayName)) {
            throw ConflictException.displayNameTaken();
        }

        Instant now = clock.instant();
        User user = User.builder()
                .email(normalizedEmail)
                .displayName(sanitizedDisplayName)
                .passwordHash(passwordService.hash(password))
                .emailVerified(false)
                .createdAt(now)
                .updatedAt(now)
                .build();

        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // lost a race against a concurrent registration with the same email or display name
            throw conflictFor(e);
        }

        verificationCodeService.issueVerificationCode(user.getId(), normalizedEmail);

        auditLogger.logAudit(AuditEvent.of(AuditEvent.Type.USER_REGISTERED, user.getId(),
                securityUtils.getCurrentCorrelationId(), Map.of("email", securityUtils.maskEmail(normalizedEmail))));
        log.info("User registered: userId={}", user.getId());

        return new RegistrationResult(user.getId(), normalizedEmail);
    }

    private ConflictException conflictFor(DataIntegrityViolationException e) {
        String detail = e.getMostSpecificCause().getMessage();
        if (detail != null && detail.contains(DISPLAY_NAME_CONSTRAINT)) {
            return ConflictException.displayNameTaken();
        }
        return ConflictException.emailTaken();
    }

    public record RegistrationResult(UUID userId, String email) {}
}
