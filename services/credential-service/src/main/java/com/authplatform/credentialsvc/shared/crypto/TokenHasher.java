package com.authplatform.credentialsvc.shared.crypto;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Generation and SHA-256 hashing of opaque credentials (session tokens, reset tokens, verification codes).
 * Only hashes are persisted; raw values leave the service exactly once.
 */
@Component
public class TokenHasher {

    private static final int TOKEN_BYTES = 32;

    private final SecureRandom secureRandom;
    private final HexFormat hexFormat;

    public TokenHasher() {
        this(new SecureRandom());
    }

    TokenHasher(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
        this.hexFormat = HexFormat.of();
    }

    /**
     * Generates a 32-byte random token as a 64-char lowercase hex string.
     */
    public String generateToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return hexFormat.formatHex(bytes);
    }

    /**
     * Generates a uniformly distributed numeric code of the given length, leading zeros kept.
     */
    public String generateNumericCode(int digits) {
        if (digits < 1 || digits > 9) {
            throw new IllegalArgumentException("digits must be between 1 and 9");
        }
        int bound = (int) Math.pow(10, digits);
        int value = secureRandom.nextInt(bound);
        return String.format("%0" + digits + "d", value);
    }

    /**
     * Hashes a token using SHA-256, returning a 64-char hex string.
     */
    public String hash(String token) {
        if (token == null || token.isEmpty()) {
            throw new IllegalArgumentException("Token cannot be null or empty");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return hexFormat.formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Constant-time comparison of a raw token against a stored hash.
     */
    public boolean verify(String token, String expectedHash) {
        if (token == null || token.isEmpty() || expectedHash == null) {
            return false;
        }
        return MessageDigest.isEqual(
                hash(token).getBytes(StandardCharsets.UTF_8),
                expectedHash.getBytes(StandardCharsets.UTF_8)
        );
    }
}
