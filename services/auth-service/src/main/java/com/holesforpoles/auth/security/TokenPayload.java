package com.holesforpoles.auth.security;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * TokenPayload - The claims carried inside an issued access token.
 *
 * Claims:
 * - sub: Identity of the user the token was issued to (stringified user id)
 * - exp: Absolute expiration instant, second granularity
 * - scopes: Ordered permission names, empty for tokens issued by login/refresh
 *
 * The payload is never stored server-side. Once signed it only exists inside
 * the token string held by the client.
 *
 * @see JwtTokenCodec#encode for construction
 * @see JwtTokenCodec#decode for verification
 */
@Value
@Builder
public class TokenPayload {

    /** User identity asserted by the token. */
    String subject;

    /** Instant after which the token is rejected. */
    Instant expiresAt;

    /** Permission scopes, in issuance order. */
    @Singular
    List<String> scopes;
}
