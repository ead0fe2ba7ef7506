package com.holesforpoles.auth.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.holesforpoles.auth.exception.AuthErrorKind;
import com.holesforpoles.auth.exception.AuthException;
import com.holesforpoles.auth.exception.GlobalExceptionHandler;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * Writes the 401 response for protected endpoints reached without a usable token.
 *
 * The body has the same ProblemDetail shape as controller errors. Missing
 * tokens and rejected tokens get the same generic message.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request,
                         HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        AuthErrorKind kind = AuthErrorKind.INVALID_TOKEN;
        Object failure = request.getAttribute(JwtAuthenticationFilter.AUTH_FAILURE_ATTRIBUTE);
        if (failure instanceof AuthException) {
            kind = ((AuthException) failure).getKind();
        }
        log.debug("Unauthenticated request to {}: {}", request.getRequestURI(), kind);

        ProblemDetail problem = GlobalExceptionHandler.problemFor(kind, kind.getDefaultMessage());
        problem.setInstance(URI.create(request.getRequestURI()));

        response.setStatus(kind.getStatus().value());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(problem));
    }
}
