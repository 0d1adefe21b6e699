package com.sanctions.screening.core;

import com.sanctions.screening.domain.ScreeningResult;

import java.time.Duration;
import java.util.Optional;

/**
 * Memoizes screening results across requests. Implementations must be safe for concurrent use
 * and may throw {@link ScreeningCacheException}; callers treat that as a miss.
 */
public interface ScreeningCache {

    /** A copy of the stored result flagged {@code cacheHit=true}, or empty on a miss. */
    Optional<ScreeningResult> get(String key);

    void put(String key, ScreeningResult value, Duration ttl);

    CacheMetrics metrics();

    void invalidateAll();
}
