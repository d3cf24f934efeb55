package com.authplatform.credentialsvc.integration;

import com.authplatform.credentialsvc.api.dto.request.EmailAddressRequest;
import com.authplatform.credentialsvc.api.dto.request.VerifyEmailRequest;
import com.authplatform.credentialsvc.infra.persistence.UserRepository;
import com.authplatform.credentialsvc.infra.persistence.VerificationCodeRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class VerificationIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private VerificationCodeRepository codeRepository;

    @Test
    void codeVerifiesOnceAndOnlyOnce() throws Exception {
        String email = uniqueEmail("verify");
        UUID userId = register(email);
        String code = latestVerificationCode(userId);

        MvcResult first = postJson("/api/v1/auth/verify-email", new VerifyEmailRequest(email, code));
        MvcResult second = postJson("/api/v1/auth/verify-email", new VerifyEmailRequest(email, code));

        assertThat(first.getResponse().getStatus()).isEqualTo(200);
        assertThat(second.getResponse().getStatus()).isEqualTo(400);
        assertThat(json(second).get("errorCode").asText()).isEqualTo("INVALID_TOKEN");
        assertThat(userRepository.findById(userId)).get().matches(u -> u.isEmailVerified());
    }

    @Test
    void codeIsBoundToTheAddressItWasSentTo() throws Exception {
        String email = uniqueEmail("bound");
        UUID userId = register(email);

        MvcResult result = postJson("/api/v1/auth/verify-email",
                new VerifyEmailRequest(uniqueEmail("other"), latestVerificationCode(userId)));

        assertThat(result.getResponse().getStatus()).isEqualTo(400);
        assertThat(userRepository.findById(userId)).get().matches(u -> !u.isEmailVerified());
    }

    @Test
    void expiredCodeIsRejected() throws Exception {
        String email = uniqueEmail("expired");
        UUID userId = register(email);
        String code = latestVerificationCode(userId);
        codeRepository.findAll().stream()
                .filter(c -> c.getUserId().equals(userId))
                .forEach(c -> {
                    c.setExpiresAt(Instant.now().minus(1, ChronoUnit.SECONDS));
                    codeRepository.save(c);
                });

        MvcResult result = postJson("/api/v1/auth/verify-email", new VerifyEmailRequest(email, code));

        assertThat(result.getResponse().getStatus()).isEqualTo(400);
        assertThat(codeRepository.findAll()).noneMatch(c -> c.getUserId().equals(userId));
    }

    @Test
    void malformedCodeIsAValidationError() throws Exception {
        MvcResult result = postJson("/api/v1/auth/verify-email", new VerifyEmailRequest(uniqueEmail("fmt"), "12ab56"));

        assertThat(result.getResponse().getStatus()).isEqualTo(400);
        assertThat(json(result).get("errorCode").asText()).isEqualTo("VALIDATION_ERROR");
    }

    @Test
    void fourthCodeWithinTheHourIsRateLimited() throws Exception {
        String email = uniqueEmail("limit");
        register(email);

        MvcResult second = postJson("/api/v1/auth/resend-verification", new EmailAddressRequest(email));
        MvcResult third = postJson("/api/v1/auth/resend-verification", new EmailAddressRequest(email));
        MvcResult fourth = postJson("/api/v1/auth/resend-verification", new EmailAddressRequest(email));

        assertThat(second.getResponse().getStatus()).isEqualTo(202);
        assertThat(third.getResponse().getStatus()).isEqualTo(202);
        assertThat(fourth.getResponse().getStatus()).isEqualTo(429);
        assertThat(Long.parseLong(fourth.getResponse().getHeader("Retry-After"))).isBetween(3500L, 3600L);
    }

    @Test
    void resendAndForgotAnswerIdenticallyForKnownAndUnknownAddresses() throws Exception {
        String unverified = uniqueEmail("known");
        register(unverified);
        String verified = uniqueEmail("verified");
        registerAndVerify(verified);
        String unknown = uniqueEmail("unknown");

        MvcResult resendKnown = postJson("/api/v1/auth/resend-verification", new EmailAddressRequest(unverified));
        MvcResult resendVerified = postJson("/api/v1/auth/resend-verification", new EmailAddressRequest(verified));
        MvcResult resendUnknown = postJson("/api/v1/auth/resend-verification", new EmailAddressRequest(unknown));

        assertThat(resendKnown.getResponse().getStatus()).isEqualTo(202);
        assertThat(resendVerified.getResponse().getStatus()).isEqualTo(202);
        assertThat(resendUnknown.getResponse().getStatus()).isEqualTo(202);
        assertThat(resendKnown.getResponse().getContentAsByteArray())
                .isEqualTo(resendUnknown.getResponse().getContentAsByteArray())
                .isEqualTo(resendVerified.getResponse().getContentAsByteArray());

        MvcResult forgotKnown = postJson("/api/v1/auth/forgot-password", new EmailAddressRequest(verified));
        MvcResult forgotUnknown = postJson("/api/v1/auth/forgot-password", new EmailAddressRequest(unknown));

        assertThat(forgotKnown.getResponse().getStatus()).isEqualTo(202);
        assertThat(forgotUnknown.getResponse().getStatus()).isEqualTo(202);
        assertThat(forgotKnown.getResponse().getContentAsByteArray())
                .isEqualTo(forgotUnknown.getResponse().getContentAsByteArray());
    }
}
