package com.holesforpoles.auth.service;

import com.holesforpoles.auth.exception.AuthErrorKind;

import java.util.List;

/**
 * Result of validating a registration request.
 *
 * @param violations every rule that failed, in the order they were checked (empty when valid)
 */
public record ValidationResult(List<Violation> violations) {

    /**
     * One failed rule.
     *
     * @param kind error kind reported to the client
     * @param message human-readable description of the rule
     */
    public record Violation(AuthErrorKind kind, String message) {
    }

    public static ValidationResult ok() {
        return new ValidationResult(List.of());
    }

    public static ValidationResult of(List<Violation> violations) {
        return new ValidationResult(List.copyOf(violations));
    }

    public boolean isValid() {
        return violations.isEmpty();
    }
}
