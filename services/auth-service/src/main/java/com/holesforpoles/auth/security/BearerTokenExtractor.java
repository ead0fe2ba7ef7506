package com.holesforpoles.auth.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Pulls the token out of an {@code Authorization: Bearer <token>} header.
 */
public final class BearerTokenExtractor {

    private static final String PREFIX = "bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * @param authorizationHeader raw header value, may be null
     * @return the token, or empty if the header is missing, uses another
     *         scheme, or has nothing after the scheme
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= PREFIX.length()
                || !trimmed.substring(0, PREFIX.length()).toLowerCase(Locale.ROOT).equals(PREFIX)
                || !Character.isWhitespace(trimmed.charAt(PREFIX.length()))) {
            return Optional.empty();
        }
        String token = trimmed.substring(PREFIX.length()).strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
