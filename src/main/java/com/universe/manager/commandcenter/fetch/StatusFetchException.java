package com.universe.manager.commandcenter.fetch;

import com.universe.manager.commandcenter.model.ErrorKind;

/**
 * Raised by a {@link StatusFetcher} for a single failed attempt.
 */
public class StatusFetchException extends Exception {

    private final ErrorKind kind;

    public StatusFetchException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        if (kind == null || kind == ErrorKind.EXHAUSTED) {
            throw new IllegalArgumentException("Single attempt failure must be TRANSPORT or DECODE, got " + kind);
        }
        this.kind = kind;
    }

    public static StatusFetchException transport(String message) {
        return new StatusFetchException(ErrorKind.TRANSPORT, message, null);
    }

    public static StatusFetchException transport(String message, Throwable cause) {
        return new StatusFetchException(ErrorKind.TRANSPORT, message, cause);
    }

    public static StatusFetchException decode(String message) {
        return new StatusFetchException(ErrorKind.DECODE, message, null);
    }

    public static StatusFetchException decode(String message, Throwable cause) {
        return new StatusFetchException(ErrorKind.DECODE, message, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }
}
