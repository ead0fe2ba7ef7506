package com.holesforpoles.auth.security;

import lombok.Getter;

/**
 * Raised by {@link JwtTokenCodec#decode} when a token cannot be accepted.
 *
 * The reason is kept for logs and tests only. Callers at the HTTP boundary
 * collapse every reason into one "invalid token" response.
 */
@Getter
public class InvalidTokenException extends RuntimeException {

    public enum Reason {
        /** Signature does not match the process secret or algorithm. */
        INVALID_SIGNATURE,
        /** Token is not three segments or lacks sub/exp/scopes in usable form. */
        MALFORMED,
        /** Expiration instant is at or before the current time. */
        EXPIRED
    }

    private final Reason reason;

    public InvalidTokenException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public InvalidTokenException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
