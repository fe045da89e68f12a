package com.agora.forum.security;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * One-way salted hashing for local credentials, backed by BCrypt.
 *
 * Verification is deliberately slow (cost from {@code security.password.bcrypt-strength}).
 * A malformed or empty digest never throws; it simply does not match.
 *
 * BCrypt only reads the first {@value #MAX_PASSWORD_BYTES} bytes of its input,
 * so longer plaintexts are refused by {@link #hash} and never match in
 * {@link #verify}.
 */
@Component
public class PasswordHasher {

    public static final int MAX_PASSWORD_BYTES = 72;

    private final PasswordEncoder passwordEncoder;

    /** Digest of a throwaway value, used to spend the same time on unknown accounts. */
    private final String decoyDigest;

    public PasswordHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
        this.decoyDigest = passwordEncoder.encode("decoy-password-for-unknown-accounts");
    }

    public String hash(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("password must not be null");
        }
        if (!fitsBcrypt(plaintext)) {
            throw new IllegalArgumentException("password must be at most " + MAX_PASSWORD_BYTES + " bytes");
        }
        return passwordEncoder.encode(plaintext);
    }

    public boolean verify(String plaintext, String digest) {
        if (plaintext == null || digest == null || digest.isEmpty() || !fitsBcrypt(plaintext)) {
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, digest);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Run one full verify against the decoy digest and discard the result.
     * Called when a login names no known account, so the response time does
     * not reveal whether the email exists.
     */
    public void verifyDecoy(String plaintext) {
        verify(plaintext == null ? "" : plaintext, decoyDigest);
    }

    /**
     * Whether BCrypt sees every byte of {@code plaintext} (UTF-8).
     */
    public static boolean fitsBcrypt(String plaintext) {
        return plaintext.getBytes(StandardCharsets.UTF_8).length <= MAX_PASSWORD_BYTES;
    }
}
