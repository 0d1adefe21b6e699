package com.sanctions.screening.decision;

import com.sanctions.screening.domain.ScoreBreakdown;
import com.sanctions.screening.domain.ScreeningTier;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything the decision engine needs, assembled by the orchestrator.
 */
@Value
@Builder
public class DecisionEvidence {

    ScoreBreakdown breakdown;
    @Builder.Default
    boolean shouldProcess = true;
    boolean inputHasIdentifiers;
    boolean inputHasDateOfBirth;
    /** Tier that produced the best candidate; null when there were no candidates. */
    ScreeningTier decisiveTier;
    /** Degradation codes in the order they occurred, e.g. {@code backend_unavailable:vector}. */
    @Singular
    List<String> degradations;
}
