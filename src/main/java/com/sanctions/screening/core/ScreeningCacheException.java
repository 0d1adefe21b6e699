package com.sanctions.screening.core;

/**
 * Cache store or read failure. Recovered locally: the request proceeds as a cache miss.
 */
public class ScreeningCacheException extends RuntimeException {

    public ScreeningCacheException(String message) {
        super(message);
    }

    public ScreeningCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
