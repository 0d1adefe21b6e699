package com.sanctions.screening.core.tier;

import lombok.Value;

/**
 * Recoverable failure recorded on a tier result.
 */
@Value
public class TierError {

    public enum Type {
        /** Index call failed, timed out, was rejected by an open circuit, or only returned a partial result. */
        BACKEND_UNAVAILABLE
    }

    Type type;
    String message;
    /** True when some candidates were still retrieved before the failure. */
    boolean partial;

    public static TierError backendUnavailable(String message) {
        return new TierError(Type.BACKEND_UNAVAILABLE, message, false);
    }

    public static TierError partialResult(String message) {
        return new TierError(Type.BACKEND_UNAVAILABLE, message, true);
    }
}
