package com.authplatform.credentialsvc.domain.session;

import com.authplatform.credentialsvc.domain.model.User;
import com.authplatform.credentialsvc.infra.persistence.UserRepository;
import com.authplatform.credentialsvc.infrastructure.logging.AuditLogger;
import com.authplatform.credentialsvc.infrastructure.logging.SecurityEvent;
import com.authplatform.credentialsvc.shared.crypto.PasswordService;
import com.authplatform.credentialsvc.shared.exception.AuthenticationFailedException;
import com.authplatform.credentialsvc.shared.exception.EmailNotVerifiedException;
import com.authplatform.credentialsvc.shared.security.SecurityUtils;
import com.authplatform.credentialsvc.shared.validation.ValidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Password login. Unknown email and wrong password fail with the same error.
 */
@Service
@Slf4j
public class LoginService {

    private final UserRepository userRepository;
    private final PasswordService passwordService;
    private final SessionService sessionService;
    private final ValidationService validationService;
    private final AuditLogger auditLogger;
    private final SecurityUtils securityUtils;

    public LoginService(
            UserRepository userRepository,
            PasswordService passwordService,
            SessionService sessionService,
            ValidationService validationService,
            AuditLogger auditLogger,
            SecurityUtils securityUtils) {
        this.userRepository = userRepository;
        this.passwordService = passwordService;
        this.sessionService = sessionService;
        this.validationService = validationService;
        this.auditLogger = auditLogger;
        this.securityUtils = securityUtils;
    }

    public SessionTokens login(String email, String password, String ipAddress) {
        String normalizedEmail = validationService.normalizeEmail(email);

        Optional<User> found = normalizedEmail == null || normalizedEmail.isEmpty()
                ? Optional.empty()
                : userRepository.findByEmail(normalizedEmail);
        if (found.isEmpty()) {
            passwordService.verifyAgainstDummy(password);
            recordFailure(null, ipAddress, normalizedEmail, "unknown account");
            throw AuthenticationFailedException.badCredentials();
        }

        User user = found.get();
        if (!user.hasPassword()) {
            recordFailure(user, ipAddress, normalizedEmail, "social account");
            throw AuthenticationFailedException.socialAccount();
        }
        if (!passwordService.verify(password, user.getPasswordHash())) {
            recordFailure(user, ipAddress, normalizedEmail, "wrong password");
            throw AuthenticationFailedException.badCredentials();
        }
        if (!user.isEmailVerified()) {
            throw new EmailNotVerifiedException();
        }

        securityUtils.setMdcUser(user.getId().toString());
        log.info("Login succeeded: userId={}", user.getId());
        return sessionService.issueSession(user.getId());
    }

    private void recordFailure(User user, String ipAddress, String email, String reason) {
        auditLogger.logSecurity(SecurityEvent.loginFailed(user == null ? null : user.getId(), ipAddress, email,
                securityUtils.getCurrentCorrelationId(), reason));
    }
}
