package com.authplatform.credentialsvc.infrastructure.notification;

import java.util.UUID;

/**
 * Hand-off point to the external mail collaborator. Calls are fire-and-forget for the caller;
 * delivery failures are recorded and logged by the implementation, never thrown back.
 */
public interface NotificationGateway {

    void sendVerificationCode(UUID userId, String email, String code);

    void sendPasswordResetLink(UUID userId, String email, String token);
}
