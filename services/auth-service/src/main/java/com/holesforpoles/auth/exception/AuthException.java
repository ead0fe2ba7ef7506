package com.holesforpoles.auth.exception;

import lombok.Getter;

/**
 * Thrown by the authentication service and the authorization guard.
 *
 * The message is what the client sees. For 401 kinds it is always the kind's
 * generic message; any internal detail goes in the cause.
 */
@Getter
public class AuthException extends RuntimeException {

    private final AuthErrorKind kind;

    public AuthException(AuthErrorKind kind) {
        this(kind, kind.getDefaultMessage(), null);
    }

    public AuthException(AuthErrorKind kind, String message) {
        this(kind, message, null);
    }

    public AuthException(AuthErrorKind kind, Throwable cause) {
        this(kind, kind.getDefaultMessage(), cause);
    }

    private AuthException(AuthErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
