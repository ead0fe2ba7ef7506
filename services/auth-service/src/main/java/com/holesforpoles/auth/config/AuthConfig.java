package com.holesforpoles.auth.config;

import com.holesforpoles.auth.security.CredentialHasher;
import com.holesforpoles.auth.security.JwtProperties;
import com.holesforpoles.auth.security.JwtTokenCodec;
import com.holesforpoles.auth.security.PasswordHashingPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;

/**
 * Wires the authentication core from configuration.
 *
 * The secret, algorithm and hashing cost are read once here; the resulting
 * beans are immutable for the life of the process.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({JwtProperties.class, PasswordHashingPolicy.class})
public class AuthConfig {

    static final int GENERATED_SECRET_BYTES = 32;

    /**
     * @return UTC system clock, replaced by a fixed clock in tests
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * @param policy bound {@code password.*} settings
     * @return BCrypt hasher at the configured cost
     */
    @Bean
    public CredentialHasher credentialHasher(PasswordHashingPolicy policy) {
        return new CredentialHasher(policy);
    }

    /**
     * @param properties bound {@code jwt.*} settings
     * @param clock time source for issuing and checking expiry
     * @return codec keyed by the configured or generated secret
     */
    @Bean
    public JwtTokenCodec jwtTokenCodec(JwtProperties properties, Clock clock) {
        return new JwtTokenCodec(resolveSecret(properties.secret()), properties.algorithm(), clock);
    }

    /**
     * Secret bytes for the signing key. Without a configured secret a random
     * 32-byte value is drawn and used in its URL-safe Base64 text form.
     */
    static byte[] resolveSecret(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured.getBytes(StandardCharsets.UTF_8);
        }
        log.warn("jwt.secret is not set; using a random secret, tokens will not survive a restart");
        byte[] random = new byte[GENERATED_SECRET_BYTES];
        new SecureRandom().nextBytes(random);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(random).getBytes(StandardCharsets.UTF_8);
    }
}
