package com.sanctions.screening.api;

/**
 * A programming invariant was violated (e.g. decision weights out of range).
 * Never silently corrected; surfaced to the caller as HTTP 500.
 */
public class ScreeningInternalException extends RuntimeException {

    public ScreeningInternalException(String message) {
        super(message);
    }

    public ScreeningInternalException(String message, Throwable cause) {
        super(message, cause);
    }
}
