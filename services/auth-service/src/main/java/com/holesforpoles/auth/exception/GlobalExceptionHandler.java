package com.holesforpoles.auth.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps exceptions thrown by controllers to RFC 7807 ProblemDetail responses.
 *
 * <pre>
 * {
 *   "title": "Unauthorized",
 *   "status": 401,
 *   "detail": "Incorrect username or password",
 *   "timestamp": "2025-07-12T10:30:00Z"
 * }
 * </pre>
 *
 * 401 responses also carry {@code WWW-Authenticate: Bearer}. Unexpected
 * failures are logged in full and answered with an opaque message.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String BEARER_CHALLENGE = "Bearer";

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ProblemDetail> handleAuth(AuthException ex) {
        log.warn("Request rejected: {}", ex.getKind());
        return toResponse(problemFor(ex.getKind(), ex.getMessage()), ex.getKind().isAuthenticationFailure());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ProblemDetail> handleUnreadableRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Malformed request");
        problem.setTitle("Bad Request");
        problem.setProperty("timestamp", Instant.now().toString());
        return toResponse(problem, false);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse) {
            // framework-level rejections (404, 405, 415) keep their own status
            ErrorResponse framework = (ErrorResponse) ex;
            log.debug("Request rejected by framework: {}", ex.getMessage());
            return ResponseEntity.status(framework.getStatusCode()).body(framework.getBody());
        }
        log.error("Internal server error", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setProperty("timestamp", Instant.now().toString());
        return toResponse(problem, false);
    }

    /**
     * Build the body for an auth failure. Shared with the security entry point
     * so filter-level rejections look the same as controller-level ones.
     */
    public static ProblemDetail problemFor(AuthErrorKind kind, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(kind.getStatus(), detail);
        problem.setTitle(kind.getStatus().getReasonPhrase());
        problem.setProperty("timestamp", Instant.now().toString());
        return problem;
    }

    private static ResponseEntity<ProblemDetail> toResponse(ProblemDetail problem, boolean challenge) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(problem.getStatus());
        if (challenge) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, BEARER_CHALLENGE);
        }
        return builder.body(problem);
    }
}
