package com.authplatform.credentialsvc.domain.session;

import com.authplatform.credentialsvc.config.CredentialMetrics;
import com.authplatform.credentialsvc.domain.model.SessionToken;
import com.authplatform.credentialsvc.infra.persistence.SessionTokenRepository;
import com.authplatform.credentialsvc.infrastructure.logging.AuditEvent;
import com.authplatform.credentialsvc.infrastructure.logging.AuditLogger;
import com.authplatform.credentialsvc.infrastructure.logging.SecurityEvent;
import com.authplatform.credentialsvc.shared.crypto.TokenHasher;
import com.authplatform.credentialsvc.shared.exception.InvalidTokenException;
import com.authplatform.credentialsvc.shared.security.SecurityUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Session (refresh token) lifecycle: issue, rotate, revoke.
 *
 * <p>Only SHA-256 hashes of session tokens are stored. Rotation deletes the presented row with a
 * conditional delete and inserts its successor in the same transaction; the delete's row count
 * decides which of several concurrent rotations of one token wins.
 */
@Service
@Slf4j
public class SessionService {

    private final SessionTokenRepository sessionTokenRepository;
    private final AccessTokenService accessTokenService;
    private final TokenHasher tokenHasher;
    private final AuditLogger auditLogger;
    private final SecurityUtils securityUtils;
    private final CredentialMetrics metrics;
    private final Clock clock;
    private final Duration sessionTtl;
    private final boolean revokeAllOnReuse;
    private final Duration retryGrace;

    public SessionService(
            SessionTokenRepository sessionTokenRepository,
            AccessTokenService accessTokenService,
            TokenHasher tokenHasher,
            AuditLogger auditLogger,
            SecurityUtils securityUtils,
            CredentialMetrics metrics,
            Clock clock,
            @Value("${app.session.ttl-days:7}") long sessionTtlDays,
            @Value("${app.session.reuse-detection.enabled:true}") boolean revokeAllOnReuse,
            @Value("${app.session.reuse-detection.grace-seconds:30}") long retryGraceSeconds) {
        this.sessionTokenRepository = sessionTokenRepository;
        this.accessTokenService = accessTokenService;
        this.tokenHasher = tokenHasher;
        this.auditLogger = auditLogger;
        this.securityUtils = securityUtils;
        this.metrics = metrics;
        this.clock = clock;
        this.sessionTtl = Duration.ofDays(sessionTtlDays);
        this.revokeAllOnReuse = revokeAllOnReuse;
        this.retryGrace = Duration.ofSeconds(retryGraceSeconds);
    }

    @Transactional
    public SessionTokens issueSession(UUID userId) {
        Instant now = clock.instant();
        String rawToken = persistSessionToken(userId, null, now);
        AccessToken accessToken = accessTokenService.issue(userId);

        metrics.sessionIssued();
        auditLogger.logAudit(AuditEvent.of(AuditEvent.Type.SESSION_ISSUED, userId, securityUtils.getCurrentCorrelationId()));

        return new SessionTokens(userId, accessToken, rawToken, now.plus(sessionTtl));
    }

    /**
     * Exchanges a session token for a new one. The presented token is unusable afterwards.
     *
     * @throws InvalidTokenException if the token is unknown, expired, already rotated, or lost a
     *         concurrent rotation race
     */
    @Transactional(noRollbackFor = InvalidTokenException.class)
    public SessionTokens rotateSession(String presentedToken) {
        if (presentedToken == null || presentedToken.isBlank()) {
            throw new InvalidTokenException(InvalidTokenException.Kind.SESSION_TOKEN);
        }
        Instant now = clock.instant();
        String presentedHash = tokenHasher.hash(presentedToken);

        Optional<SessionToken> found = sessionTokenRepository.findByTokenHash(presentedHash);
        if (found.isEmpty()) {
            handleUnknownToken(presentedHash, now);
            throw new InvalidTokenException(InvalidTokenException.Kind.SESSION_TOKEN);
        }

        SessionToken current = found.get();
        if (current.isExpired(now)) {
            sessionTokenRepository.deleteRowById(current.getId());
            log.debug("Expired session token removed on rotation: userId={}", current.getUserId());
            throw new InvalidTokenException(InvalidTokenException.Kind.SESSION_TOKEN);
        }

        if (sessionTokenRepository.deleteLiveById(current.getId(), now) != 1) {
            log.info("Session rotation lost a concurrent race: userId={}", current.getUserId());
            throw new InvalidTokenException(InvalidTokenException.Kind.SESSION_TOKEN);
        }

        UUID userId = current.getUserId();
        String rawToken = persistSessionToken(userId, presentedHash, now);
        AccessToken accessToken = accessTokenService.issue(userId);

        metrics.sessionRotated();
        log.debug("Session rotated: userId={}", userId);
        return new SessionTokens(userId, accessToken, rawToken, now.plus(sessionTtl));
    }

    /**
     * Deletes the session if it exists. Unknown tokens are not an error.
     */
    @Transactional
    public void revokeSession(String token) {
        if (token == null || token.isBlank()) {
            return;
        }
        int deleted = sessionTokenRepository.deleteByTokenHash(tokenHasher.hash(token));
        log.debug("Session revoke: deleted={}", deleted);
    }

    @Transactional
    public int revokeAllSessions(UUID userId) {
        int deleted = sessionTokenRepository.deleteAllByUserId(userId);
        auditLogger.logAudit(AuditEvent.of(AuditEvent.Type.SESSIONS_REVOKED, userId,
                securityUtils.getCurrentCorrelationId(), Map.of("count", String.valueOf(deleted))));
        return deleted;
    }

    public boolean isReuseDetectionEnabled() {
        return revokeAllOnReuse;
    }

    /**
     * A token with no row may be a replay of one that was already rotated. Its successor row
     * records the replayed hash as {@code previousTokenHash}. A successor younger than the retry
     * grace means the client is resending a request whose response it lost; that call fails but
     * leaves the successor alone.
     */
    private void handleUnknownToken(String presentedHash, Instant now) {
        Optional<SessionToken> successor = sessionTokenRepository.findFirstByPreviousTokenHash(presentedHash);
        if (successor.isEmpty()) {
            return;
        }

        UUID userId = successor.get().getUserId();
        if (successor.get().getCreatedAt().isAfter(now.minus(retryGrace))) {
            log.info("Duplicate rotation of an already rotated session within retry grace: userId={}", userId);
            return;
        }
        metrics.sessionReuseDetected();

        int revoked = 0;
        if (revokeAllOnReuse) {
            revoked = sessionTokenRepository.deleteAllByUserId(userId);
        }
        log.warn("Rotated session token presented again: userId={}, sessionsRevoked={}", userId, revoked);
        auditLogger.logSecurity(SecurityEvent.sessionReuse(userId, securityUtils.getCurrentCorrelationId(),
                Map.of("sessionsRevoked", String.valueOf(revoked),
                        "revokeAllOnReuse", String.valueOf(revokeAllOnReuse))));
    }

    private String persistSessionToken(UUID userId, String previousTokenHash, Instant now) {
        String rawToken = tokenHasher.generateToken();
        sessionTokenRepository.save(SessionToken.builder()
                .tokenHash(tokenHasher.hash(rawToken))
                .userId(userId)
                .previousTokenHash(previousTokenHash)
                .expiresAt(now.plus(sessionTtl))
                .createdAt(now)
                .build());
        return rawToken;
    }
}
