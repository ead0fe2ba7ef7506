package com.holesforpoles.auth.security;

import com.holesforpoles.auth.entity.User;
import com.holesforpoles.auth.exception.AuthErrorKind;
import com.holesforpoles.auth.exception.AuthException;
import com.holesforpoles.auth.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * AuthorizationGuard - Turns a bearer token into the user making the request.
 *
 * Checks, in order:
 * 1. The token decodes (signature, structure, expiry); any failure is INVALID_TOKEN
 * 2. The subject names an existing account; otherwise USER_NOT_FOUND
 * 3. The account is active; otherwise INACTIVE_ACCOUNT
 *
 * There is no revocation list. Deactivating an account is the only way to
 * refuse a token before it expires, and it takes effect on the next request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthorizationGuard {

    private final JwtTokenCodec tokenCodec;
    private final UserRepository userRepository;

    /**
     * @param token compact token string, without the scheme prefix
     * @return the active user the token was issued to
     * @throws AuthException INVALID_TOKEN, USER_NOT_FOUND or INACTIVE_ACCOUNT
     */
    @Transactional(readOnly = true)
    public User resolve(String token) {
        TokenPayload payload;
        try {
            payload = tokenCodec.decode(token);
        } catch (InvalidTokenException e) {
            log.warn("Token rejected: {} ({})", e.getReason(), e.getMessage());
            throw new AuthException(AuthErrorKind.INVALID_TOKEN, e);
        }

        User user = parseUserId(payload.getSubject())
                .flatMap(userRepository::findById)
                .orElseThrow(() -> {
                    log.warn("Token subject {} does not match any user", payload.getSubject());
                    return new AuthException(AuthErrorKind.USER_NOT_FOUND);
                });

        if (!user.isActive()) {
            log.warn("Token refused for inactive user {}", user.getId());
            throw new AuthException(AuthErrorKind.INACTIVE_ACCOUNT);
        }
        return user;
    }

    private static Optional<Long> parseUserId(String subject) {
        try {
            return Optional.of(Long.valueOf(subject));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
