package com.authplatform.credentialsvc.domain.verification;

import com.authplatform.credentialsvc.domain.model.User;
import com.authplatform.credentialsvc.infra.persistence.UserRepository;
import com.authplatform.credentialsvc.infrastructure.logging.AuditEvent;
import com.authplatform.credentialsvc.infrastructure.logging.AuditLogger;
import com.authplatform.credentialsvc.shared.security.SecurityUtils;
import com.authplatform.credentialsvc.shared.validation.ValidationService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Optional;

/**
 * Resends a verification code. The outcome is never visible to the caller except for the
 * per-address rate limit, so the endpoint cannot be used to probe for accounts.
 */
@Service
public class ResendVerificationService {

    private final UserRepository userRepository;
    private final VerificationCodeService verificationCodeService;
    private final ValidationService validationService;
    private final AuditLogger auditLogger;
    private final SecurityUtils securityUtils;

    public ResendVerificationService(
            UserRepository userRepository,
            VerificationCodeService verificationCodeService,
            ValidationService validationService,
            AuditLogger auditLogger,
            SecurityUtils securityUtils) {
        this.userRepository = userRepository;
        this.verificationCodeService = verificationCodeService;
        this.validationService = validationService;
        this.auditLogger = auditLogger;
        this.securityUtils = securityUtils;
    }

    @Transactional
    public void resend(String email) {
        String normalizedEmail = validationService.normalizeEmail(email);
        if (normalizedEmail == null || normalizedEmail.isEmpty()) {
            return;
        }

        Optional<User> userOpt = userRepository.findByEmail(normalizedEmail);
        if (userOpt.isPresent() && !userOpt.get().isEmailVerified()) {
            verificationCodeService.issueVerificationCode(userOpt.get().getId(), normalizedEmail);
        }

        auditLogger.logAudit(AuditEvent.of(AuditEvent.Type.RESEND_REQUESTED, null,
                securityUtils.getCurrentCorrelationId(), Map.of("maskedEmail", securityUtils.maskEmail(normalizedEmail))));
    }
}
