package com.sanctions.screening.index;

/**
 * The index could not answer in time or at all. Tiers recover from it locally:
 * they contribute no candidates and the degradation is surfaced in the decision reasons.
 */
public class BackendUnavailableException extends RuntimeException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
