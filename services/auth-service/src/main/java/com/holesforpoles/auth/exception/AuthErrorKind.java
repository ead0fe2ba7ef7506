package com.holesforpoles.auth.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Every way an authentication request can be refused.
 *
 * Registration kinds are user-correctable and report a specific message with
 * 400. Authentication and authorization kinds report 401 with a generic
 * message; INVALID_TOKEN and USER_NOT_FOUND share one so a caller cannot tell
 * a deleted account from a bad token.
 */
@Getter
@RequiredArgsConstructor
public enum AuthErrorKind {

    DUPLICATE_EMAIL(HttpStatus.BAD_REQUEST, "Email already registered"),
    DUPLICATE_USERNAME(HttpStatus.BAD_REQUEST, "Username already taken"),
    WEAK_PASSWORD(HttpStatus.BAD_REQUEST, "Password does not meet strength requirements"),
    INVALID_EMAIL(HttpStatus.BAD_REQUEST, "Email address is not valid"),
    INVALID_USERNAME(HttpStatus.BAD_REQUEST, "Username must be between 3 and 50 characters"),

    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Incorrect username or password"),
    INACTIVE_ACCOUNT(HttpStatus.UNAUTHORIZED, "Inactive user"),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "Could not validate credentials"),
    USER_NOT_FOUND(HttpStatus.UNAUTHORIZED, "Could not validate credentials");

    private final HttpStatus status;
    private final String defaultMessage;

    public boolean isAuthenticationFailure() {
        return status == HttpStatus.UNAUTHORIZED;
    }
}
