package com.holesforpoles.auth.security;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.holesforpoles.auth.security.InvalidTokenException.Reason;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SecurityException;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * JwtTokenCodec - Encodes and decodes signed, time-limited access tokens.
 *
 * Token Structure (compact JWS, RFC 7515):
 * - Header: Algorithm (HS256 by default) and token type
 * - Payload: sub (user id), iat, exp (seconds since epoch), scopes (string array)
 * - Signature: HMAC over header and payload using the process secret
 *
 * The codec does not know about token lifetimes. Callers pass the absolute
 * expiration they want; the configured default lives in {@link JwtProperties}
 * and is applied by the authentication service.
 *
 * Decoding order:
 * 1. Structure: three base64url segments, a JSON payload with sub and exp
 * 2. Expiration: exp must be strictly after the current instant
 * 3. Signature: verified with the secret and the configured algorithm
 *
 * Expiration is checked before the signature, so an expired token is reported
 * as EXPIRED whether or not its signature would verify.
 *
 * Instances are immutable and safe to share between request threads.
 *
 * @see InvalidTokenException.Reason for the failure kinds
 */
public class JwtTokenCodec {

    private static final String SCOPES_CLAIM = "scopes";

    private static final ObjectMapper PAYLOAD_READER = new ObjectMapper();

    private final SecretKey signingKey;
    private final SignatureAlgorithm algorithm;
    private final Clock clock;

    /**
     * @param secret raw HMAC secret, at least as long as the algorithm's digest
     * @param algorithmName JWA name of an HMAC algorithm (HS256, HS384, HS512)
     * @param clock time source for issuance and expiry checks
     * @throws IllegalArgumentException if the algorithm is unknown, not HMAC,
     *         or the secret is too short for it
     */
    public JwtTokenCodec(byte[] secret, String algorithmName, Clock clock) {
        SignatureAlgorithm resolved;
        try {
            resolved = SignatureAlgorithm.forName(algorithmName);
        } catch (JwtException e) {
            throw new IllegalArgumentException("Unknown token algorithm: " + algorithmName, e);
        }
        if (!resolved.isHmac()) {
            throw new IllegalArgumentException("Token algorithm must be HMAC-based, got " + algorithmName);
        }
        SecretKey key;
        try {
            key = Keys.hmacShaKeyFor(secret);
            resolved.assertValidSigningKey(key);
        } catch (SecurityException e) {
            throw new IllegalArgumentException("Signing secret is too weak for " + algorithmName, e);
        }
        this.signingKey = key;
        this.algorithm = resolved;
        this.clock = clock;
    }

    /**
     * Create a signed token for the given subject.
     *
     * @param subject user identity, stored as the sub claim
     * @param scopes permission scopes, may be empty
     * @param expiresAt absolute expiration, must be after the current instant
     * @return compact token string (header.payload.signature)
     */
    public String encode(String subject, List<String> scopes, Instant expiresAt) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Token subject must not be blank");
        }
        Instant now = clock.instant();
        if (!expiresAt.isAfter(now)) {
            throw new IllegalArgumentException("Token expiration must be in the future");
        }
        return Jwts.builder()
                .setSubject(subject)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(expiresAt))
                .claim(SCOPES_CLAIM, scopes == null ? List.of() : List.copyOf(scopes))
                .signWith(signingKey, algorithm)
                .compact();
    }

    /**
     * Verify a token and return its claims.
     *
     * @param token compact token string, without the "Bearer " prefix
     * @return decoded payload
     * @throws InvalidTokenException with reason MALFORMED, EXPIRED or INVALID_SIGNATURE
     */
    public TokenPayload decode(String token) {
        Map<String, Object> unverified = readPayload(token);
        Instant expiresAt = requireExpiration(unverified.get(Claims.EXPIRATION));
        requireSubject(unverified.get(Claims.SUBJECT));
        requireScopes(unverified.get(SCOPES_CLAIM));

        Instant now = clock.instant();
        if (!expiresAt.isAfter(now)) {
            throw new InvalidTokenException(Reason.EXPIRED, "Token expired at " + expiresAt);
        }

        Jws<Claims> jws = verify(token);
        if (!algorithm.getValue().equals(jws.getHeader().getAlgorithm())) {
            throw new InvalidTokenException(Reason.INVALID_SIGNATURE,
                    "Unexpected token algorithm: " + jws.getHeader().getAlgorithm());
        }

        Claims claims = jws.getBody();
        return TokenPayload.builder()
                .subject(requireSubject(claims.get(Claims.SUBJECT)))
                .expiresAt(requireExpiration(claims.get(Claims.EXPIRATION)))
                .scopes(requireScopes(claims.get(SCOPES_CLAIM)))
                .build();
    }

    private Jws<Claims> verify(String token) {
        try {
            return Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token);
        } catch (ExpiredJwtException e) {
            throw new InvalidTokenException(Reason.EXPIRED, "Token expired", e);
        } catch (SecurityException e) {
            throw new InvalidTokenException(Reason.INVALID_SIGNATURE, "Token signature does not match", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException(Reason.MALFORMED, "Token could not be parsed", e);
        }
    }

    private static Map<String, Object> readPayload(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException(Reason.MALFORMED, "Token is empty");
        }
        String[] segments = token.split("\\.", -1);
        if (segments.length != 3 || segments[1].isEmpty()) {
            throw new InvalidTokenException(Reason.MALFORMED, "Token must have three segments");
        }
        try {
            byte[] json = Decoders.BASE64URL.decode(segments[1]);
            Map<String, Object> payload = PAYLOAD_READER.readValue(json, new TypeReference<Map<String, Object>>() { });
            if (payload == null) {
                throw new InvalidTokenException(Reason.MALFORMED, "Token payload is empty");
            }
            return payload;
        } catch (JwtException | IllegalArgumentException | IOException e) {
            throw new InvalidTokenException(Reason.MALFORMED, "Token payload is not valid JSON", e);
        }
    }

    private static String requireSubject(Object value) {
        if (value instanceof String && !((String) value).isBlank()) {
            return (String) value;
        }
        if (value instanceof Number) {
            return String.valueOf(integralValue((Number) value, "subject"));
        }
        throw new InvalidTokenException(Reason.MALFORMED, "Token has no usable subject");
    }

    private static Instant requireExpiration(Object value) {
        if (value instanceof Number) {
            long seconds = integralValue((Number) value, "expiration");
            try {
                return Instant.ofEpochSecond(seconds);
            } catch (DateTimeException e) {
                throw new InvalidTokenException(Reason.MALFORMED, "Token expiration is out of range", e);
            }
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        throw new InvalidTokenException(Reason.MALFORMED, "Token has no usable expiration");
    }

    /**
     * Exact long value of a JSON number. Fractions and values outside the long
     * range are MALFORMED rather than silently truncated.
     */
    private static long integralValue(Number value, String claim) {
        try {
            if (value instanceof Integer || value instanceof Long
                    || value instanceof Short || value instanceof Byte) {
                return value.longValue();
            }
            if (value instanceof BigInteger) {
                return ((BigInteger) value).longValueExact();
            }
            BigDecimal decimal = value instanceof BigDecimal
                    ? (BigDecimal) value
                    : new BigDecimal(value.toString());
            return decimal.longValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new InvalidTokenException(Reason.MALFORMED, "Token " + claim + " must be a whole number", e);
        }
    }

    private static List<String> requireScopes(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new InvalidTokenException(Reason.MALFORMED, "Token scopes must be a list");
        }
        List<?> raw = (List<?>) value;
        List<String> scopes = new ArrayList<>(raw.size());
        for (Object scope : raw) {
            if (!(scope instanceof String)) {
                throw new InvalidTokenException(Reason.MALFORMED, "Token scopes must be strings");
            }
            scopes.add((String) scope);
        }
        return scopes;
    }
}
