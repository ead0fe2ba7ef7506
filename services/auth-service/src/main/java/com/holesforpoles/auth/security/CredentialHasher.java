package com.holesforpoles.auth.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * CredentialHasher - One-way password hashing and verification.
 *
 * Wraps a BCrypt encoder configured from a {@link PasswordHashingPolicy}.
 * Every call to {@link #hash} draws a fresh random salt, so hashing the same
 * password twice gives two different strings that both verify.
 *
 * Hash format: {@code $2a$<cost>$<22 char salt><31 char digest>} (60 chars).
 * BCrypt compares digests without early exit.
 *
 * BCrypt only reads the first 72 bytes of its input. A password longer than
 * that (in UTF-8) is first reduced to the Base64 form of its SHA-256 digest,
 * so every byte of it counts and the encoder never sees an over-long input.
 *
 * Stateless apart from the encoder, which is thread-safe.
 */
@Slf4j
public class CredentialHasher {

    /** Longest input BCrypt reads in full. */
    public static final int BCRYPT_MAX_BYTES = 72;

    private final PasswordEncoder encoder;

    public CredentialHasher(PasswordHashingPolicy policy) {
        this.encoder = new BCryptPasswordEncoder(policy.bcryptStrength());
    }

    /**
     * Hash a plaintext password with a new random salt.
     *
     * @param plaintext password as entered by the user, never null
     * @return encoded hash suitable for storage
     */
    public String hash(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Password must not be null");
        }
        return encoder.encode(bcryptInput(plaintext));
    }

    /**
     * Check a plaintext password against a stored hash.
     *
     * Fails closed: a null, empty or non-BCrypt hash yields false rather than
     * an exception.
     *
     * @param plaintext candidate password
     * @param hash value previously produced by {@link #hash}
     * @return true only if the password matches
     */
    public boolean verify(String plaintext, String hash) {
        if (plaintext == null || hash == null || hash.isEmpty()) {
            return false;
        }
        try {
            return encoder.matches(bcryptInput(plaintext), hash);
        } catch (IllegalArgumentException e) {
            log.warn("Stored password hash could not be compared: {}", e.getMessage());
            return false;
        }
    }

    static String bcryptInput(String plaintext) {
        byte[] bytes = plaintext.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= BCRYPT_MAX_BYTES) {
            return plaintext;
        }
        try {
            return Base64.getEncoder().encodeToString(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
