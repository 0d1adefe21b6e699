package com.sanctions.screening.api;

/**
 * The caller cancelled the screening; in-flight backend calls were aborted and nothing was cached.
 */
public class ScreeningCancelledException extends RuntimeException {

    public ScreeningCancelledException(String message) {
        super(message);
    }

    public ScreeningCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
