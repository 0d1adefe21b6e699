package com.sanctions.screening.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Canonical input produced by the upstream normalizer. Immutable and scoped to one request.
 */
@Value
@Builder(toBuilder = true)
public class NormalizedEntity {

    /** Ordered canonical name tokens, e.g. ["ivan", "petrov"]. */
    List<String> tokens;
    String language;
    LocalDate dateOfBirth;
    /** Identifier strings in TYPE:VALUE form, e.g. "INN:1234567890". */
    List<String> identifiers;
    EntityType entityType;
    PolicyFlags policyFlags;
    UpstreamSignals signals;

    public PolicyFlags flags() {
        return policyFlags != null ? policyFlags : PolicyFlags.none();
    }

    public UpstreamSignals signalsOrDefault() {
        return signals != null ? signals : UpstreamSignals.none();
    }

    public EntityType typeOrDefault() {
        return entityType != null ? entityType : EntityType.PERSON;
    }

    public List<String> identifiersOrEmpty() {
        return identifiers != null ? identifiers : List.of();
    }

    public boolean hasIdentifiers() {
        return identifiers != null && !identifiers.isEmpty();
    }

    public boolean hasDateOfBirth() {
        return dateOfBirth != null;
    }

    public String fullName() {
        return tokens == null ? "" : String.join(" ", tokens);
    }
}
