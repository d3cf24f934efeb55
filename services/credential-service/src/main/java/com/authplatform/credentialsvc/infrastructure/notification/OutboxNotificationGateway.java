package com.authplatform.credentialsvc.infrastructure.notification;

import com.authplatform.credentialsvc.infrastructure.outbox.OutboxPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;
import java.util.UUID;

/**
 * Enqueues notifications in the outbox so they commit together with the credential they announce.
 * {@link com.authplatform.credentialsvc.infrastructure.outbox.OutboxDispatcher} delivers them afterwards.
 */
@Component
@Slf4j
public class OutboxNotificationGateway implements NotificationGateway {

    public static final String AGGREGATE_TYPE = "User";
    public static final String VERIFICATION_CODE_REQUESTED = "EmailVerificationCodeRequested";
    public static final String PASSWORD_RESET_REQUESTED = "PasswordResetRequested";

    private final OutboxPublisher outboxPublisher;
    private final String resetBaseUrl;
    private final long verificationCodeTtlMinutes;

    public OutboxNotificationGateway(
            OutboxPublisher outboxPublisher,
            @Value("${app.password-reset.base-url:http://localhost:3000/reset-password}") String resetBaseUrl,
            @Value("${app.verification-code.ttl-minutes:5}") long verificationCodeTtlMinutes) {
        this.outboxPublisher = outboxPublisher;
        this.resetBaseUrl = resetBaseUrl;
        this.verificationCodeTtlMinutes = verificationCodeTtlMinutes;
    }

    @Override
    public void sendVerificationCode(UUID userId, String email, String code) {
        outboxPublisher.publish(AGGREGATE_TYPE, userId, VERIFICATION_CODE_REQUESTED, Map.of(
                "userId", userId.toString(),
                "email", email,
                "code", code,
                "expiresInMinutes", String.valueOf(verificationCodeTtlMinutes)
        ));
        log.debug("Verification code notification enqueued: userId={}", userId);
    }

    @Override
    public void sendPasswordResetLink(UUID userId, String email, String token) {
        String link = UriComponentsBuilder.fromUriString(resetBaseUrl)
                .queryParam("token", token)
                .build()
                .toUriString();
        outboxPublisher.publish(AGGREGATE_TYPE, userId, PASSWORD_RESET_REQUESTED, Map.of(
                "userId", userId.toString(),
                "email", email,
                "resetLink", link
        ));
        log.debug("Password reset notification enqueued: userId={}", userId);
    }
}
