package com.sanctions.screening.index;

import com.sanctions.screening.domain.EntityType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/**
 * One sanctioned party as stored in the index. Mapping into a candidate happens in the tiers.
 */
@Value
@Builder
@Jacksonized
public class WatchlistRecord {

    String id;
    String name;
    List<String> aliases;
    EntityType entityType;
    LocalDate dateOfBirth;
    List<String> identifiers;
    String program;
    String country;

    public List<String> aliasesOrEmpty() {
        return aliases != null ? aliases : List.of();
    }

    public List<String> identifiersOrEmpty() {
        return identifiers != null ? identifiers : List.of();
    }
}
