package com.authplatform.credentialsvc.shared.crypto;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Argon2id password hashing with a fixed work factor.
 */
@Service
public class PasswordService {

    private final Argon2 argon2;
    private final int memoryKb;
    private final int iterations;
    private final int parallelism;
    private final String dummyHash;

    public PasswordService(
            @Value("${app.argon2.memory-kb:19456}") int memoryKb,
            @Value("${app.argon2.iterations:2}") int iterations,
            @Value("${app.argon2.parallelism:1}") int parallelism) {
        this.argon2 = Argon2Factory.create(Argon2Factory.Argon2Types.ARGON2id);
        this.memoryKb = memoryKb;
        this.iterations = iterations;
        this.parallelism = parallelism;
        this.dummyHash = hash("credential-service-timing-equalizer");
    }

    /**
     * Returns an encoded hash starting with {@code $argon2id$} that embeds salt and parameters.
     */
    public String hash(String password) {
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        char[] chars = password.toCharArray();
        try {
            return argon2.hash(iterations, memoryKb, parallelism, chars);
        } finally {
            argon2.wipeArray(chars);
        }
    }

    public boolean verify(String password, String hash) {
        if (password == null || hash == null) {
            return false;
        }
        char[] chars = password.toCharArray();
        try {
            return argon2.verify(hash, chars);
        } finally {
            argon2.wipeArray(chars);
        }
    }

    /**
     * Burns one verification against a fixed hash so that a login for an unknown account
     * costs the same as one for a known account.
     */
    public void verifyAgainstDummy(String password) {
        verify(password == null ? "" : password, dummyHash);
    }
}
