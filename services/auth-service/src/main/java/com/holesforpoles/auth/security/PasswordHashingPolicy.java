package com.holesforpoles.auth.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Password hashing parameters, bound from {@code password.*}.
 *
 * Passed to {@link CredentialHasher} at construction so tests and deployments
 * can pick their own cost without touching shared state.
 *
 * @param bcryptStrength BCrypt log-rounds, between 4 and 31
 */
@ConfigurationProperties(prefix = "password")
public record PasswordHashingPolicy(@DefaultValue("10") int bcryptStrength) {

    public PasswordHashingPolicy {
        if (bcryptStrength < 4 || bcryptStrength > 31) {
            throw new IllegalArgumentException("BCrypt strength must be between 4 and 31, got " + bcryptStrength);
        }
    }
}
