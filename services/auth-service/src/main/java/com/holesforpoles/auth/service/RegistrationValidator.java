package com.holesforpoles.auth.service;

import com.holesforpoles.auth.dto.RegisterRequest;
import com.holesforpoles.auth.exception.AuthErrorKind;
import com.holesforpoles.auth.service.ValidationResult.Violation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks a registration request before any account is created.
 *
 * Rules, in evaluation order:
 * - password: at least 8 characters, one digit, one uppercase letter
 * - email: present and shaped like local@domain.tld
 * - username: 3 to 50 characters
 *
 * Only registration runs these checks.
 */
@Component
public class RegistrationValidator {

    public static final int MIN_PASSWORD_LENGTH = 8;
    public static final int MIN_USERNAME_LENGTH = 3;
    public static final int MAX_USERNAME_LENGTH = 50;

    /** Local part is dot-separated atoms: no leading, trailing or doubled dots. */
    private static final Pattern EMAIL = Pattern.compile(
            "^[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]+(?:\\.[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]+)*"
                    + "@[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?"
                    + "(?:\\.[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?)*\\.[A-Za-z]{2,}$");

    /**
     * Run every rule against the request.
     *
     * @param request registration payload, already trimmed
     * @return all violations in evaluation order, or an empty result
     */
    public ValidationResult validate(RegisterRequest request) {
        List<Violation> violations = new ArrayList<>();
        checkPassword(request.getPassword(), violations);
        checkEmail(request.getEmail(), violations);
        checkUsername(request.getUsername(), violations);
        return violations.isEmpty() ? ValidationResult.ok() : ValidationResult.of(violations);
    }

    private static void checkPassword(String password, List<Violation> violations) {
        if (password == null || password.codePointCount(0, password.length()) < MIN_PASSWORD_LENGTH) {
            violations.add(new Violation(AuthErrorKind.WEAK_PASSWORD,
                    "Password must be at least " + MIN_PASSWORD_LENGTH + " characters"));
            return;
        }
        if (password.codePoints().noneMatch(Character::isDigit)) {
            violations.add(new Violation(AuthErrorKind.WEAK_PASSWORD,
                    "Password must contain at least one digit"));
        }
        if (password.codePoints().noneMatch(Character::isUpperCase)) {
            violations.add(new Violation(AuthErrorKind.WEAK_PASSWORD,
                    "Password must contain at least one uppercase letter"));
        }
    }

    private static void checkEmail(String email, List<Violation> violations) {
        if (email == null || !EMAIL.matcher(email).matches()) {
            violations.add(new Violation(AuthErrorKind.INVALID_EMAIL, AuthErrorKind.INVALID_EMAIL.getDefaultMessage()));
        }
    }

    private static void checkUsername(String username, List<Violation> violations) {
        int length = username == null ? 0 : username.codePointCount(0, username.length());
        if (length < MIN_USERNAME_LENGTH || length > MAX_USERNAME_LENGTH) {
            violations.add(new Violation(AuthErrorKind.INVALID_USERNAME,
                    AuthErrorKind.INVALID_USERNAME.getDefaultMessage()));
        }
    }
}
