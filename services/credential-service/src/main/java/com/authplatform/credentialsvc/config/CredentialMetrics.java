package com.authplatform.credentialsvc.config;

import com.authplatform.credentialsvc.domain.ratelimit.RateLimitScope;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Micrometer counters for the credential lifecycle.
 */
@Component
public class CredentialMetrics {

    private static final String SERVICE_TAG = "credential-service";

    private final MeterRegistry registry;
    private final Counter sessionIssued;
    private final Counter sessionRotated;
    private final Counter sessionReuseDetected;
    private final Counter verificationCodeIssued;
    private final Counter verificationCodeConsumed;
    private final Counter passwordResetRequested;
    private final Counter passwordResetCompleted;
    private final Counter ghostAccountsReaped;

    public CredentialMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.sessionIssued = counter("credential.session.issued.total", "Sessions issued at login");
        this.sessionRotated = counter("credential.session.rotated.total", "Successful session rotations");
        this.sessionReuseDetected = counter("credential.session.reuse.detected.total",
                "Replays of an already-rotated session token");
        this.verificationCodeIssued = counter("credential.verification.issued.total", "Verification codes issued");
        this.verificationCodeConsumed = counter("credential.verification.consumed.total",
                "Verification codes consumed successfully");
        this.passwordResetRequested = counter("credential.password.reset.requested.total",
                "Password reset tokens issued");
        this.passwordResetCompleted = counter("credential.password.reset.completed.total",
                "Passwords changed through a reset token");
        this.ghostAccountsReaped = counter("credential.reaper.deleted.total",
                "Unverified accounts removed by the reaper");
    }

    public void sessionIssued() {
        sessionIssued.increment();
    }

    public void sessionRotated() {
        sessionRotated.increment();
    }

    public void sessionReuseDetected() {
        sessionReuseDetected.increment();
    }

    public void verificationCodeIssued() {
        verificationCodeIssued.increment();
    }

    public void verificationCodeConsumed() {
        verificationCodeConsumed.increment();
    }

    public void passwordResetRequested() {
        passwordResetRequested.increment();
    }

    public void passwordResetCompleted() {
        passwordResetCompleted.increment();
    }

    public void ghostAccountsReaped(int count) {
        ghostAccountsReaped.increment(count);
    }

    public void rateLimitDenied(RateLimitScope scope) {
        Counter.builder("rate.limit.exceeded.total")
                .description("Requests rejected by the rate limiter")
                .tag("service", SERVICE_TAG)
                .tag("scope", scope.name())
                .register(registry)
                .increment();
    }

    public void rateLimitFailOpen(RateLimitScope scope) {
        Counter.builder("rate.limit.fail.open.total")
                .description("Requests allowed unmetered because the limiter store failed")
                .tag("service", SERVICE_TAG)
                .tag("scope", scope.name())
                .register(registry)
                .increment();
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name)
                .description(description)
                .tag("service", SERVICE_TAG)
                .register(registry);
    }
}
