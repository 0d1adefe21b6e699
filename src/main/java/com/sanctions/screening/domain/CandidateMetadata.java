package com.sanctions.screening.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/**
 * Watchlist facts attached to a candidate for audit and for the rerank exact rules.
 */
@Value
@Builder
@Jacksonized
public class CandidateMetadata {

    List<String> aliases;
    /** Sanction programme, e.g. "RU-SANCTIONS-2022". */
    String program;
    String country;
    LocalDate dateOfBirth;
    List<String> identifiers;

    public List<String> aliasesOrEmpty() {
        return aliases != null ? aliases : List.of();
    }

    public List<String> identifiersOrEmpty() {
        return identifiers != null ? identifiers : List.of();
    }
}
