package com.holesforpoles.auth.service;

import com.holesforpoles.auth.dto.RegisterRequest;
import com.holesforpoles.auth.dto.TokenResponse;
import com.holesforpoles.auth.entity.User;
import com.holesforpoles.auth.exception.AuthErrorKind;
import com.holesforpoles.auth.exception.AuthException;
import com.holesforpoles.auth.repository.UserRepository;
import com.holesforpoles.auth.security.CredentialHasher;
import com.holesforpoles.auth.security.JwtProperties;
import com.holesforpoles.auth.security.JwtTokenCodec;
import com.holesforpoles.auth.service.ValidationResult.Violation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * AuthService - Registration, login and token refresh.
 *
 * Key Responsibilities:
 * - Validate and create accounts, enforcing unique email and username
 * - Authenticate a username or email with a password and issue a token
 * - Re-issue a token for a caller the guard has already authenticated
 *
 * Stateless Sessions: nothing is persisted on login or refresh. The token is
 * self-contained and expires after the configured lifetime.
 *
 * Enumeration Resistance: an unknown identifier and a wrong password raise
 * the same INVALID_CREDENTIALS error, and both paths run one BCrypt
 * comparison.
 *
 * @see CredentialHasher for password hashing
 * @see JwtTokenCodec for token encoding
 * @see com.holesforpoles.auth.security.AuthorizationGuard for token resolution
 */
@Service
@Slf4j
public class AuthService {

    private final UserRepository userRepository;
    private final CredentialHasher credentialHasher;
    private final JwtTokenCodec tokenCodec;
    private final RegistrationValidator registrationValidator;
    private final Duration tokenLifetime;
    private final Clock clock;

    /** Compared against when no account matches, so the miss costs one BCrypt check too. */
    private final String unknownUserHash;

    public AuthService(UserRepository userRepository,
                       CredentialHasher credentialHasher,
                       JwtTokenCodec tokenCodec,
                       RegistrationValidator registrationValidator,
                       JwtProperties jwtProperties,
                       Clock clock) {
        this.userRepository = userRepository;
        this.credentialHasher = credentialHasher;
        this.tokenCodec = tokenCodec;
        this.registrationValidator = registrationValidator;
        this.tokenLifetime = jwtProperties.expiration();
        this.clock = clock;
        this.unknownUserHash = credentialHasher.hash("unknown-user-placeholder");
    }

    /**
     * Create a new account.
     *
     * Flow:
     * 1. Trim email and username, lower-case the email domain, validate all fields
     * 2. Reject a registered email, then a taken username
     * 3. Hash the password and insert the user (active, not superuser)
     *
     * A concurrent registration that slips past step 2 is caught by the
     * unique constraints and reported as the matching duplicate error.
     *
     * @param request registration payload
     * @return the persisted user, with id and timestamps assigned
     * @throws AuthException WEAK_PASSWORD, INVALID_EMAIL, INVALID_USERNAME,
     *         DUPLICATE_EMAIL or DUPLICATE_USERNAME
     */
    @Transactional
    public User register(RegisterRequest request) {
        RegisterRequest normalized = RegisterRequest.builder()
                .email(normalizeEmail(request.getEmail()))
                .username(trim(request.getUsername()))
                .fullName(request.getFullName())
                .password(request.getPassword())
                .build();

        ValidationResult validation = registrationValidator.validate(normalized);
        if (!validation.isValid()) {
            Violation first = validation.violations().get(0);
            log.warn("Registration rejected: {}", first.kind());
            throw new AuthException(first.kind(), first.message());
        }

        if (userRepository.existsByEmail(normalized.getEmail())) {
            log.warn("Registration rejected: {}", AuthErrorKind.DUPLICATE_EMAIL);
            throw new AuthException(AuthErrorKind.DUPLICATE_EMAIL);
        }
        if (userRepository.existsByUsername(normalized.getUsername())) {
            log.warn("Registration rejected: {}", AuthErrorKind.DUPLICATE_USERNAME);
            throw new AuthException(AuthErrorKind.DUPLICATE_USERNAME);
        }

        User user = User.builder()
                .email(normalized.getEmail())
                .username(normalized.getUsername())
                .fullName(normalized.getFullName())
                .hashedPassword(credentialHasher.hash(normalized.getPassword()))
                .active(true)
                .superuser(false)
                .build();

        User saved;
        try {
            saved = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            throw duplicateFrom(e);
        }
        log.info("Registered user {} ({})", saved.getId(), saved.getUsername());
        return saved;
    }

    /**
     * Authenticate with a username or email and a password.
     *
     * The identifier is tried as a username first, then as an email with
     * its domain lower-cased the way registration stores it.
     *
     * @param identifier username or email
     * @param password plaintext password
     * @return bearer token for the account
     * @throws AuthException INVALID_CREDENTIALS or INACTIVE_ACCOUNT
     */
    @Transactional(readOnly = true)
    public TokenResponse login(String identifier, String password) {
        Optional<User> match = userRepository.findByUsername(identifier)
                .or(() -> userRepository.findByEmail(normalizeEmail(identifier)));

        if (match.isEmpty()) {
            credentialHasher.verify(password, unknownUserHash);
            log.warn("Login failed for identifier: {}", identifier);
            throw new AuthException(AuthErrorKind.INVALID_CREDENTIALS);
        }

        User user = match.get();
        if (!credentialHasher.verify(password, user.getHashedPassword())) {
            log.warn("Login failed for identifier: {}", identifier);
            throw new AuthException(AuthErrorKind.INVALID_CREDENTIALS);
        }
        if (!user.isActive()) {
            log.warn("Login refused for inactive user {}", user.getId());
            throw new AuthException(AuthErrorKind.INACTIVE_ACCOUNT);
        }

        log.info("User {} logged in", user.getId());
        return TokenResponse.bearer(issueToken(user));
    }

    /**
     * Issue a fresh token for a caller the guard has already resolved.
     *
     * @param currentUser authenticated, active user
     * @return new bearer token with the default lifetime
     */
    public TokenResponse refresh(User currentUser) {
        log.info("Refreshing token for user {}", currentUser.getId());
        return TokenResponse.bearer(issueToken(currentUser));
    }

    private String issueToken(User user) {
        return tokenCodec.encode(String.valueOf(user.getId()), List.of(), clock.instant().plus(tokenLifetime));
    }

    private static AuthException duplicateFrom(DataIntegrityViolationException e) {
        String detail = String.valueOf(e.getMostSpecificCause().getMessage()).toLowerCase(Locale.ROOT);
        if (detail.contains(User.UK_EMAIL)) {
            log.warn("Registration lost a race on email");
            return new AuthException(AuthErrorKind.DUPLICATE_EMAIL, e);
        }
        if (detail.contains(User.UK_USERNAME)) {
            log.warn("Registration lost a race on username");
            return new AuthException(AuthErrorKind.DUPLICATE_USERNAME, e);
        }
        throw e;
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }

    /** Domains are case-insensitive, the local part is not. */
    static String normalizeEmail(String email) {
        String trimmed = trim(email);
        if (trimmed == null) {
            return null;
        }
        int at = trimmed.lastIndexOf('@');
        if (at < 0) {
            return trimmed;
        }
        return trimmed.substring(0, at + 1) + trimmed.substring(at + 1).toLowerCase(Locale.ROOT);
    }
}
