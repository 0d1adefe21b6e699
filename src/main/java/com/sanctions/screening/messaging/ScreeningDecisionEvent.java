package com.sanctions.screening.messaging;

import com.sanctions.screening.domain.RequiredField;
import com.sanctions.screening.domain.RiskLevel;
import com.sanctions.screening.domain.ScreeningTier;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Emitted to Kafka for every screening decision. Immutable audit record of what was decided
 * and why; identity data only appears masked.
 */
@Value
@Builder
@Jacksonized
public class ScreeningDecisionEvent {

    String eventId;
    String requestId;
    /** Hash of the canonical request; equal for identical inputs. */
    String requestKey;
    String maskedName;
    List<String> maskedIdentifiers;
    RiskLevel riskLevel;
    double riskScore;
    boolean reviewRequired;
    List<RequiredField> requiredAdditionalFields;
    List<String> decisionReasons;
    ScreeningTier decisiveTier;
    String topCandidateId;
    int candidateCount;
    List<ScreeningTier> tiersExecuted;
    boolean earlyStopped;
    boolean cacheHit;
    Instant timestamp;
    /** SCREENING_DECIDED */
    String eventType;
}
