package com.sanctions.screening.core.tier;

import com.sanctions.screening.domain.Candidate;
import com.sanctions.screening.domain.CandidateMetadata;
import com.sanctions.screening.domain.EntityType;
import com.sanctions.screening.domain.MatchedField;
import com.sanctions.screening.domain.ScreeningTier;
import com.sanctions.screening.index.WatchlistRecord;

import java.util.EnumSet;
import java.util.Set;

/**
 * Maps raw index records into tier candidates.
 */
final class CandidateMapper {

    private CandidateMapper() {}

    static Candidate toCandidate(WatchlistRecord record, ScreeningTier tier, double rawScore, Set<MatchedField> fields) {
        return Candidate.builder()
                .id(record.getId())
                .matchedText(record.getName())
                .entityType(record.getEntityType() != null ? record.getEntityType() : EntityType.PERSON)
                .sourceTier(tier.getLevel())
                .rawScore(rawScore)
                .matchedFields(fields.isEmpty() ? EnumSet.noneOf(MatchedField.class) : EnumSet.copyOf(fields))
                .metadata(CandidateMetadata.builder()
                        .aliases(record.aliasesOrEmpty())
                        .program(record.getProgram())
                        .country(record.getCountry())
                        .dateOfBirth(record.getDateOfBirth())
                        .identifiers(record.identifiersOrEmpty())
                        .build())
                .build();
    }
}
