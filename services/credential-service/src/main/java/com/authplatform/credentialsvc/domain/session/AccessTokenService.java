package com.authplatform.credentialsvc.domain.session;

import com.authplatform.credentialsvc.config.JwtConfig;
import com.authplatform.credentialsvc.shared.exception.ExpiredTokenException;
import com.authplatform.credentialsvc.shared.exception.InvalidTokenException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimNames;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Issues and verifies short-lived HS256 access tokens. Never touches the store.
 */
@Service
public class AccessTokenService {

    private final JwtEncoder jwtEncoder;
    private final NimbusJwtDecoder signatureOnlyDecoder;
    private final Clock clock;
    private final Duration ttl;
    private final String issuer;

    public AccessTokenService(
            JwtEncoder jwtEncoder,
            SecretKey accessTokenSigningKey,
            Clock clock,
            @Value("${app.jwt.access-token-ttl-minutes:15}") long ttlMinutes,
            @Value("${app.jwt.issuer:https://auth-platform.local/credential-service}") String issuer) {
        this.jwtEncoder = jwtEncoder;
        this.clock = clock;
        this.ttl = Duration.ofMinutes(ttlMinutes);
        this.issuer = issuer;
        // expiry is checked below against the injected clock so it can report Expired separately
        this.signatureOnlyDecoder = NimbusJwtDecoder.withSecretKey(accessTokenSigningKey)
                .macAlgorithm(MacAlgorithm.HS256)
                .build();
        this.signatureOnlyDecoder.setJwtValidator(jwt -> OAuth2TokenValidatorResult.success());
    }

    public AccessToken issue(UUID userId) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .issuer(issuer)
                .subject(userId.toString())
                .issuedAt(now)
                .expiresAt(expiresAt)
                .id(UUID.randomUUID().toString())
                .claim(JwtConfig.TOKEN_TYPE_CLAIM, JwtConfig.ACCESS_TOKEN_TYPE)
                .build();
        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        String value = jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
        return new AccessToken(value, expiresAt);
    }

    /**
     * @return the user id the token was issued to
     * @throws InvalidTokenException on a malformed token, bad signature, foreign issuer or wrong token type
     * @throws ExpiredTokenException when the signature is valid but the token has expired
     */
    public UUID verify(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException(InvalidTokenException.Kind.ACCESS_TOKEN);
        }
        Jwt jwt;
        try {
            jwt = signatureOnlyDecoder.decode(token);
        } catch (JwtException e) {
            throw new InvalidTokenException(InvalidTokenException.Kind.ACCESS_TOKEN);
        }

        if (!JwtConfig.ACCESS_TOKEN_TYPE.equals(jwt.getClaimAsString(JwtConfig.TOKEN_TYPE_CLAIM))
                || !issuer.equals(jwt.getClaimAsString(JwtClaimNames.ISS))
                || jwt.getSubject() == null || jwt.getExpiresAt() == null) {
            throw new InvalidTokenException(InvalidTokenException.Kind.ACCESS_TOKEN);
        }
        if (!clock.instant().isBefore(jwt.getExpiresAt())) {
            throw new ExpiredTokenException();
        }
        try {
            return UUID.fromString(jwt.getSubject());
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException(InvalidTokenException.Kind.ACCESS_TOKEN);
        }
    }
}
