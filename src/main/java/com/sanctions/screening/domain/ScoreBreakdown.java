package com.sanctions.screening.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Named score components the decision is fused from. Continuous values are in [0,1].
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ScoreBreakdown {
    double smartfilterSignal;
    double personEvidence;
    double orgEvidence;
    /** Best reranked confidence across all tiers. */
    double similarityTop;
    /** Top candidate is a Tier0 whole-name hit on a watchlist name or alias. */
    boolean exactNameMatch;
    boolean idExactMatch;
    boolean dobMatch;
}
