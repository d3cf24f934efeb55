package com.authplatform.credentialsvc.unit;

import com.authplatform.credentialsvc.config.CredentialMetrics;
import com.authplatform.credentialsvc.domain.model.SessionToken;
import com.authplatform.credentialsvc.domain.session.AccessToken;
import com.authplatform.credentialsvc.domain.session.AccessTokenService;
import com.authplatform.credentialsvc.domain.session.SessionService;
import com.authplatform.credentialsvc.domain.session.SessionTokens;
import com.authplatform.credentialsvc.infra.persistence.SessionTokenRepository;
import com.authplatform.credentialsvc.infrastructure.logging.AuditLogger;
import com.authplatform.credentialsvc.shared.crypto.TokenHasher;
import com.authplatform.credentialsvc.shared.exception.InvalidTokenException;
import com.authplatform.credentialsvc.shared.security.SecurityUtils;
import com.authplatform.credentialsvc.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionServiceTest {

    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");
    private static final UUID USER_ID = UUID.fromString("8c5f4c52-52a4-4c37-9a51-52f3c8d2a001");
    private static final long RETRY_GRACE_SECONDS = 30;

    @Mock SessionTokenRepository sessionTokenRepository;
    @Mock AccessTokenService accessTokenService;
    @Mock AuditLogger auditLogger;

    private final TokenHasher tokenHasher = new TokenHasher();
    private final MutableClock clock = new MutableClock(T0);
    private SessionService sessionService;

    @BeforeEach
    void setUp() {
        sessionService = newService(true);
    }

    private SessionService newService(boolean reuseDetection) {
        return new SessionService(sessionTokenRepository, accessTokenService, tokenHasher, auditLogger,
                new SecurityUtils(), new CredentialMetrics(new SimpleMeterRegistry()), clock, 7, reuseDetection,
                RETRY_GRACE_SECONDS);
    }

    private SessionToken liveRow(String rawToken) {
        return SessionToken.builder()
                .id(UUID.randomUUID())
                .tokenHash(tokenHasher.hash(rawToken))
                .userId(USER_ID)
                .expiresAt(T0.plus(Duration.ofDays(7)))
                .createdAt(T0)
                .build();
    }

    @Test
    void issueSessionStoresOnlyTheHashWithSevenDayExpiry() {
        when(accessTokenService.issue(USER_ID)).thenReturn(new AccessToken("jwt", T0.plusSeconds(900)));

        SessionTokens tokens = sessionService.issueSession(USER_ID);

        ArgumentCaptor<SessionToken> saved = ArgumentCaptor.forClass(SessionToken.class);
        verify(sessionTokenRepository).save(saved.capture());
        assertThat(saved.getValue().getTokenHash()).isEqualTo(tokenHasher.hash(tokens.sessionToken()));
        assertThat(saved.getValue().getTokenHash()).isNotEqualTo(tokens.sessionToken());
        assertThat(saved.getValue().getExpiresAt()).isEqualTo(T0.plus(Duration.ofDays(7)));
        assertThat(saved.getValue().getPreviousTokenHash()).isNull();
        assertThat(tokens.accessToken().value()).isEqualTo("jwt");
    }

    @Test
    void rotateReplacesTheRowAndLinksItToThePreviousHash() {
        String oldToken = tokenHasher.generateToken();
        SessionToken row = liveRow(oldToken);
        when(sessionTokenRepository.findByTokenHash(row.getTokenHash())).thenReturn(Optional.of(row));
        when(sessionTokenRepository.deleteLiveById(row.getId(), T0)).thenReturn(1);
        when(accessTokenService.issue(USER_ID)).thenReturn(new AccessToken("jwt-2", T0.plusSeconds(900)));

        SessionTokens rotated = sessionService.rotateSession(oldToken);

        ArgumentCaptor<SessionToken> saved = ArgumentCaptor.forClass(SessionToken.class);
        verify(sessionTokenRepository).save(saved.capture());
        assertThat(rotated.sessionToken()).isNotEqualTo(oldToken);
        assertThat(saved.getValue().getTokenHash()).isEqualTo(tokenHasher.hash(rotated.sessionToken()));
        assertThat(saved.getValue().getPreviousTokenHash()).isEqualTo(row.getTokenHash());
        assertThat(rotated.userId()).isEqualTo(USER_ID);
    }

    @Test
    void rotateThatLosesTheConditionalDeleteIssuesNothing() {
        String oldToken = tokenHasher.generateToken();
        SessionToken row = liveRow(oldToken);
        when(sessionTokenRepository.findByTokenHash(row.getTokenHash())).thenReturn(Optional.of(row));
        when(sessionTokenRepository.deleteLiveById(row.getId(), T0)).thenReturn(0);

        assertThatThrownBy(() -> sessionService.rotateSession(oldToken))
                .isInstanceOf(InvalidTokenException.class)
                .hasMessage("Invalid or expired session");

        verify(sessionTokenRepository, never()).save(any());
        verifyNoInteractions(accessTokenService);
        verify(sessionTokenRepository, never()).deleteAllByUserId(any());
    }

    @Test
    void rotateOfExpiredTokenDeletesTheRowAndFails() {
        String oldToken = tokenHasher.generateToken();
        SessionToken row = liveRow(oldToken);
        when(sessionTokenRepository.findByTokenHash(row.getTokenHash())).thenReturn(Optional.of(row));
        clock.advance(Duration.ofDays(7));

        assertThatThrownBy(() -> sessionService.rotateSession(oldToken))
                .isInstanceOf(InvalidTokenException.class);

        verify(sessionTokenRepository).deleteRowById(row.getId());
        verify(sessionTokenRepository, never()).deleteLiveById(any(), any());
        verify(sessionTokenRepository, never()).save(any());
    }

    @Test
    void replayOfRotatedTokenRevokesEverySessionWhenReuseDetectionIsOn() {
        String replayed = tokenHasher.generateToken();
        String replayedHash = tokenHasher.hash(replayed);
        SessionToken successor = liveRow(tokenHasher.generateToken());
        successor.setPreviousTokenHash(replayedHash);
        when(sessionTokenRepository.findByTokenHash(replayedHash)).thenReturn(Optional.empty());
        when(sessionTokenRepository.findFirstByPreviousTokenHash(replayedHash)).thenReturn(Optional.of(successor));
        when(sessionTokenRepository.deleteAllByUserId(USER_ID)).thenReturn(2);
        clock.advance(Duration.ofMinutes(5));

        assertThatThrownBy(() -> sessionService.rotateSession(replayed))
                .isInstanceOf(InvalidTokenException.class);

        verify(sessionTokenRepository).deleteAllByUserId(USER_ID);
        verify(auditLogger).logSecurity(any());
    }

    @Test
    void replayOfRotatedTokenOnlyFailsWhenReuseDetectionIsOff() {
        SessionService lenient = newService(false);
        String replayed = tokenHasher.generateToken();
        String replayedHash = tokenHasher.hash(replayed);
        SessionToken successor = liveRow(tokenHasher.generateToken());
        when(sessionTokenRepository.findByTokenHash(replayedHash)).thenReturn(Optional.empty());
        when(sessionTokenRepository.findFirstByPreviousTokenHash(replayedHash)).thenReturn(Optional.of(successor));
        clock.advance(Duration.ofMinutes(5));

        assertThatThrownBy(() -> lenient.rotateSession(replayed))
                .isInstanceOf(InvalidTokenException.class);

        verify(sessionTokenRepository, never()).deleteAllByUserId(any());
    }

    @Test
    void retriedRotationWithinGraceFailsButLeavesTheWinnersTokenUsable() {
        List<SessionToken> table = backRepositoryWithTable();
        when(accessTokenService.issue(USER_ID)).thenReturn(new AccessToken("jwt", T0.plusSeconds(900)));

        SessionTokens original = sessionService.issueSession(USER_ID);
        clock.advance(Duration.ofSeconds(1));
        SessionTokens winner = sessionService.rotateSession(original.sessionToken());

        clock.advance(Duration.ofSeconds(2));
        assertThatThrownBy(() -> sessionService.rotateSession(original.sessionToken()))
                .isInstanceOf(InvalidTokenException.class)
                .hasMessage("Invalid or expired session");

        assertThat(table).hasSize(1);
        verify(sessionTokenRepository, never()).deleteAllByUserId(any());
        verify(auditLogger, never()).logSecurity(any());

        SessionTokens next = sessionService.rotateSession(winner.sessionToken());
        assertThat(next.userId()).isEqualTo(USER_ID);
        assertThat(table).singleElement()
                .extracting(SessionToken::getTokenHash)
                .isEqualTo(tokenHasher.hash(next.sessionToken()));
    }

    @Test
    void replayAfterTheGraceRevokesTheWinnerToo() {
        List<SessionToken> table = backRepositoryWithTable();
        when(accessTokenService.issue(USER_ID)).thenReturn(new AccessToken("jwt", T0.plusSeconds(900)));

        SessionTokens original = sessionService.issueSession(USER_ID);
        SessionTokens winner = sessionService.rotateSession(original.sessionToken());

        clock.advance(Duration.ofSeconds(RETRY_GRACE_SECONDS).plusSeconds(1));
        assertThatThrownBy(() -> sessionService.rotateSession(original.sessionToken()))
                .isInstanceOf(InvalidTokenException.class);

        assertThat(table).isEmpty();
        verify(auditLogger).logSecurity(any());
        assertThatThrownBy(() -> sessionService.rotateSession(winner.sessionToken()))
                .isInstanceOf(InvalidTokenException.class);
    }

    /**
     * Answers the repository calls rotation makes from an in-memory session table, so the
     * conditional delete and the successor lookup see each other's effects.
     */
    private List<SessionToken> backRepositoryWithTable() {
        List<SessionToken> table = new ArrayList<>();
        lenient().when(sessionTokenRepository.save(any(SessionToken.class))).thenAnswer(inv -> {
            SessionToken row = inv.getArgument(0);
            row.setId(UUID.randomUUID());
            table.add(row);
            return row;
        });
        lenient().when(sessionTokenRepository.findByTokenHash(anyString())).thenAnswer(inv ->
                table.stream().filter(r -> r.getTokenHash().equals(inv.getArgument(0))).findFirst());
        lenient().when(sessionTokenRepository.findFirstByPreviousTokenHash(anyString())).thenAnswer(inv ->
                table.stream().filter(r -> inv.getArgument(0).equals(r.getPreviousTokenHash())).findFirst());
        lenient().when(sessionTokenRepository.deleteLiveById(any(UUID.class), any(Instant.class))).thenAnswer(inv -> {
            Instant now = inv.getArgument(1);
            return table.removeIf(r -> r.getId().equals(inv.getArgument(0)) && r.getExpiresAt().isAfter(now)) ? 1 : 0;
        });
        lenient().when(sessionTokenRepository.deleteAllByUserId(any(UUID.class))).thenAnswer(inv -> {
            int before = table.size();
            table.removeIf(r -> r.getUserId().equals(inv.getArgument(0)));
            return before - table.size();
        });
        return table;
    }

    @Test
    void unknownTokenFailsWithoutRevokingAnything() {
        String unknown = tokenHasher.generateToken();
        when(sessionTokenRepository.findByTokenHash(any())).thenReturn(Optional.empty());
        when(sessionTokenRepository.findFirstByPreviousTokenHash(any())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> sessionService.rotateSession(unknown))
                .isInstanceOf(InvalidTokenException.class);

        verify(sessionTokenRepository, never()).deleteAllByUserId(any());
        verifyNoInteractions(auditLogger);
    }

    @Test
    void missingCookieIsAnInvalidSession() {
        assertThatThrownBy(() -> sessionService.rotateSession(null))
                .isInstanceOf(InvalidTokenException.class);
        verifyNoInteractions(sessionTokenRepository);
    }

    @Test
    void revokeIsIdempotent() {
        String token = tokenHasher.generateToken();
        when(sessionTokenRepository.deleteByTokenHash(tokenHasher.hash(token))).thenReturn(1, 0);

        sessionService.revokeSession(token);
        sessionService.revokeSession(token);
        sessionService.revokeSession(" ");

        verify(sessionTokenRepository, times(2)).deleteByTokenHash(tokenHasher.hash(token));
    }

    @Test
    void revokeAllDeletesEveryRowOfTheUser() {
        when(sessionTokenRepository.deleteAllByUserId(USER_ID)).thenReturn(3);

        assertThat(sessionService.revokeAllSessions(USER_ID)).isEqualTo(3);
    }
}
