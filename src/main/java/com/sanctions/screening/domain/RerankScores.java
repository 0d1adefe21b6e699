package com.sanctions.screening.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Independent sub-scores the reranker combined into {@link Candidate#getConfidence()}.
 * {@code cosine} is null when the candidate never went through vector search.
 */
@Value
@Builder
@Jacksonized
public class RerankScores {
    double editDistance;
    double phonetic;
    double exactRule;
    Double cosine;
}
