package com.sanctions.screening.core;

import com.sanctions.screening.index.WatchlistStatus;
import lombok.Value;

@Value
public class WatchlistReloadResult {
    WatchlistStatus watchlist;
    /** False when the cache was unreachable; stale entries then live until their TTL. */
    boolean cacheInvalidated;
}
