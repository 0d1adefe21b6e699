package com.sanctions.screening.index;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * What a reloadable backend is currently serving.
 */
@Value
@Builder
public class WatchlistStatus {
    String backendName;
    String source;
    int records;
    int patterns;
    /** Incremented on every successful load, starting at 1 for the startup load. */
    long generation;
    Instant loadedAt;
}
