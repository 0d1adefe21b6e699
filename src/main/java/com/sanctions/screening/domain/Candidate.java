package com.sanctions.screening.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Set;

/**
 * A watchlist record proposed by some tier as a possible match.
 * {@code rawScore} is tier-local; {@code confidence} is only meaningful after reranking.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Candidate {

    String id;
    String matchedText;
    EntityType entityType;
    /** 0-3, see {@link ScreeningTier#getLevel()}. */
    int sourceTier;
    double rawScore;
    Set<MatchedField> matchedFields;
    CandidateMetadata metadata;
    double confidence;
    RerankScores rerankScores;

    public boolean hasMatchedField(MatchedField field) {
        return matchedFields != null && matchedFields.contains(field);
    }

    /** IDENTIFIER beats DOB beats name-only; used to break rerank ties. */
    public int evidenceRank() {
        if (hasMatchedField(MatchedField.IDENTIFIER)) {
            return 2;
        }
        if (hasMatchedField(MatchedField.DOB)) {
            return 1;
        }
        return 0;
    }
}
