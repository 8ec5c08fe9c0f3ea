package com.universe.manager.commandcenter.model;

import java.util.Objects;

/**
 * Immutable description of a failed attempt.
 *
 * @param kind    failure category
 * @param message human-readable description
 * @param attempt 1-based attempt number; for EXHAUSTED the total number of attempts made
 * @param cause   final underlying error for EXHAUSTED, otherwise null
 */
public record ErrorDetail(
        ErrorKind kind,
        String message,
        int attempt,
        ErrorDetail cause
) {

    public ErrorDetail {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static ErrorDetail of(ErrorKind kind, String message, int attempt) {
        return new ErrorDetail(kind, message, attempt, null);
    }

    public static ErrorDetail exhausted(int retries, int attempts, ErrorDetail last) {
        return new ErrorDetail(
                ErrorKind.EXHAUSTED,
                "System health failed after " + retries + " retries: " + last.message(),
                attempts,
                last
        );
    }
}
