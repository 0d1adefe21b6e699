package com.sanctions.screening.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Everything one screening produced: the decision plus the audit trail behind it.
 * Cached as an immutable value; a cache hit hands out a copy flagged {@code cacheHit}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ScreeningResult {

    String requestId;
    /** Reranked candidates, best first. */
    List<Candidate> candidates;
    Decision decision;
    List<TierDiagnostic> tierDiagnostics;
    List<ScreeningTier> tiersExecuted;
    boolean earlyStopped;
    boolean cacheHit;
    long elapsedMs;
    Instant screenedAt;
}
