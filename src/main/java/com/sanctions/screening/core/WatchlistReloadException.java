package com.sanctions.screening.core;

/**
 * A watchlist reload was refused or failed. The previously loaded watchlist keeps serving.
 */
public class WatchlistReloadException extends RuntimeException {

    public WatchlistReloadException(String message) {
        super(message);
    }

    public WatchlistReloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
