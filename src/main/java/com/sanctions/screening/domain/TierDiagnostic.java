package com.sanctions.screening.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Timing and error information for one tier of one request.
 */
@Value
@Builder
@Jacksonized
public class TierDiagnostic {
    ScreeningTier tier;
    boolean executed;
    /** Why the tier did not run (early stop, policy flag, no escalation); null when executed. */
    String skipReason;
    long elapsedMs;
    int candidateCount;
    boolean escalate;
    String errorType;
    String errorMessage;
}
