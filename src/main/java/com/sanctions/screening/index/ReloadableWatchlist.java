package com.sanctions.screening.index;

import java.util.List;

/**
 * A watchlist backend whose corpus can be swapped at runtime. Searches already running keep
 * the corpus they started with.
 */
public interface ReloadableWatchlist {

    /**
     * Builds a new index over {@code records} and makes it current once complete.
     *
     * @param source where the records came from, reported by {@link #status()}
     */
    WatchlistStatus replace(List<WatchlistRecord> records, String source);

    WatchlistStatus status();
}
