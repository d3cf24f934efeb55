package com.authplatform.credentialsvc.unit;

import com.authplatform.credentialsvc.config.JwtConfig;
import com.authplatform.credentialsvc.domain.session.AccessToken;
import com.authplatform.credentialsvc.domain.session.AccessTokenService;
import com.authplatform.credentialsvc.shared.exception.ExpiredTokenException;
import com.authplatform.credentialsvc.shared.exception.InvalidTokenException;
import com.authplatform.credentialsvc.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;

import javax.crypto.SecretKey;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccessTokenServiceTest {

    private static final String SECRET = "unit-test-secret-with-at-least-32-bytes!";
    private static final String ISSUER = "https://auth-platform.local/credential-service";
    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");

    private final JwtConfig jwtConfig = new JwtConfig();
    private final MutableClock clock = new MutableClock(T0);
    private SecretKey key;
    private JwtEncoder encoder;
    private AccessTokenService service;

    @BeforeEach
    void setUp() {
        key = jwtConfig.accessTokenSigningKey(SECRET);
        encoder = jwtConfig.jwtEncoder(key);
        service = new AccessTokenService(encoder, key, clock, 15, ISSUER);
    }

    @Test
    void issuedTokenVerifiesToItsSubject() {
        UUID userId = UUID.randomUUID();

        AccessToken token = service.issue(userId);

        assertThat(token.expiresAt()).isEqualTo(T0.plus(Duration.ofMinutes(15)));
        assertThat(service.verify(token.value())).isEqualTo(userId);
    }

    @Test
    void tokenPastExpiryIsExpiredNotInvalid() {
        AccessToken token = service.issue(UUID.randomUUID());
        clock.advance(Duration.ofMinutes(15));

        assertThatThrownBy(() -> service.verify(token.value())).isInstanceOf(ExpiredTokenException.class);
    }

    @Test
    void tamperedOrForeignTokensAreInvalid() {
        AccessToken token = service.issue(UUID.randomUUID());
        int i = token.value().lastIndexOf('.') + 5;
        char c = token.value().charAt(i);
        String tampered = token.value().substring(0, i) + (c == 'A' ? 'B' : 'A') + token.value().substring(i + 1);

        SecretKey otherKey = jwtConfig.accessTokenSigningKey("another-secret-that-is-32-bytes-long!!");
        AccessTokenService foreign = new AccessTokenService(jwtConfig.jwtEncoder(otherKey), otherKey, clock, 15, ISSUER);
        String foreignToken = foreign.issue(UUID.randomUUID()).value();

        assertThatThrownBy(() -> service.verify(tampered)).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> service.verify(foreignToken)).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> service.verify("not-a-jwt")).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> service.verify(null)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void tokenOfAnotherTypeIsInvalid() {
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .issuer(ISSUER)
                .subject(UUID.randomUUID().toString())
                .issuedAt(T0)
                .expiresAt(T0.plusSeconds(900))
                .claim(JwtConfig.TOKEN_TYPE_CLAIM, "refresh")
                .build();
        String token = encoder.encode(JwtEncoderParameters.from(JwsHeader.with(MacAlgorithm.HS256).build(), claims))
                .getTokenValue();

        assertThatThrownBy(() -> service.verify(token)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void resourceServerDecoderAcceptsIssuedTokensAndRejectsExpiredOnes() {
        JwtDecoder decoder = jwtConfig.jwtDecoder(key, clock, ISSUER);
        UUID userId = UUID.randomUUID();
        String token = service.issue(userId).value();

        assertThat(decoder.decode(token).getSubject()).isEqualTo(userId.toString());

        clock.advance(Duration.ofMinutes(16));
        assertThatThrownBy(() -> decoder.decode(token)).isInstanceOf(JwtException.class);
    }

    @Test
    void shortSecretIsRejectedAtStartup() {
        assertThatThrownBy(() -> jwtConfig.accessTokenSigningKey("too-short"))
                .isInstanceOf(IllegalStateException.class);
    }
}
