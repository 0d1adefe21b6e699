package com.sanctions.screening.api;

/**
 * The normalized entity is missing required fields or carries out-of-range values.
 * Aborts the request before any tier runs; the handler returns HTTP 400.
 */
public class MalformedInputException extends RuntimeException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
