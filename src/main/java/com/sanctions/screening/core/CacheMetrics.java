package com.sanctions.screening.core;

import lombok.Value;

/**
 * Operational snapshot of a {@link ScreeningCache}.
 */
@Value
public class CacheMetrics {
    String backend;
    double hitRate;
    long size;
    long evictions;
    long hits;
    long misses;
}
