package com.holesforpoles.auth.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Token settings bound from the {@code jwt.*} properties in application.yml.
 *
 * Read once at startup and never changed afterwards. Changing the secret
 * invalidates every token issued before the restart.
 *
 * @param secret HMAC signing secret (env SECRET_KEY); a random one is generated when blank
 * @param algorithm JWA name of the HMAC algorithm, HS256 unless overridden
 * @param expiration default lifetime of tokens issued by login and refresh
 */
@ConfigurationProperties(prefix = "jwt")
public record JwtProperties(
        String secret,
        @DefaultValue("HS256") String algorithm,
        @DefaultValue("30m") Duration expiration) {
}
