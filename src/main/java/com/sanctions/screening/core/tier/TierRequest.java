package com.sanctions.screening.core.tier;

import com.sanctions.screening.core.CancellationScope;
import com.sanctions.screening.core.RequestBudget;
import com.sanctions.screening.domain.Candidate;
import com.sanctions.screening.domain.NormalizedEntity;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Input for one tier invocation. {@code candidates} is only read by the reranker.
 */
@Value
@Builder
public class TierRequest {
    NormalizedEntity entity;
    @Builder.Default
    List<Candidate> candidates = List.of();
    RequestBudget budget;
    CancellationScope scope;
}
