package com.sanctions.screening.core;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.sanctions.screening.domain.ScreeningResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process cache bounded by size with a per-entry TTL; whichever limit is reached first evicts.
 * Caffeine's striped buffers keep reads and writes off any global lock.
 */
@Slf4j
public class CaffeineScreeningCache implements ScreeningCache {

    private final Cache<String, CacheEntry> cache;
    private final Ticker ticker;
    private final Duration defaultTtl;

    public CaffeineScreeningCache(long maximumSize, Duration defaultTtl) {
        this(maximumSize, defaultTtl, Ticker.systemTicker());
    }

    public CaffeineScreeningCache(long maximumSize, Duration defaultTtl, Ticker ticker) {
        this.ticker = ticker;
        this.defaultTtl = defaultTtl;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new Expiry<String, CacheEntry>() {
                    @Override
                    public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
                        return entry.getTtlNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, CacheEntry entry, long currentTime,
                                                  long currentDuration) {
                        return entry.getTtlNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, CacheEntry entry, long currentTime,
                                                long currentDuration) {
                        return currentDuration;
                    }
                })
                .ticker(ticker)
                .executor(Runnable::run)
                .recordStats()
                .build();
        log.info("Caffeine screening cache created: maximumSize={}, defaultTtl={}", maximumSize, defaultTtl);
    }

    @Override
    public Optional<ScreeningResult> get(String key) {
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        entry.touch(ticker.read());
        return Optional.of(entry.getValue().toBuilder().cacheHit(true).build());
    }

    @Override
    public void put(String key, ScreeningResult value, Duration ttl) {
        Duration effective = ttl != null && !ttl.isNegative() && !ttl.isZero() ? ttl : defaultTtl;
        ScreeningResult stored = value.isCacheHit() ? value.toBuilder().cacheHit(false).build() : value;
        cache.put(key, new CacheEntry(stored, effective.toNanos(), ticker.read()));
    }

    @Override
    public CacheMetrics metrics() {
        CacheStats stats = cache.stats();
        return new CacheMetrics("caffeine", stats.hitRate(), cache.estimatedSize(),
                stats.evictionCount(), stats.hitCount(), stats.missCount());
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    /** Runs pending maintenance (evictions, expirations) now. */
    public void cleanUp() {
        cache.cleanUp();
    }
}
