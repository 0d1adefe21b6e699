package com.sanctions.screening.core;

import com.sanctions.screening.domain.ScreeningResult;
import lombok.Getter;

/**
 * Stored cache value. The result itself is immutable; only the access time moves.
 */
@Getter
final class CacheEntry {

    private final ScreeningResult value;
    private final long ttlNanos;
    private final long expiresAtNanos;
    private volatile long lastAccessedNanos;

    CacheEntry(ScreeningResult value, long ttlNanos, long nowNanos) {
        this.value = value;
        this.ttlNanos = ttlNanos;
        this.expiresAtNanos = nowNanos + ttlNanos;
        this.lastAccessedNanos = nowNanos;
    }

    void touch(long nowNanos) {
        lastAccessedNanos = nowNanos;
    }
}
