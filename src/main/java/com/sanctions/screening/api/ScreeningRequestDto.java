package com.sanctions.screening.api;

import com.sanctions.screening.domain.EntityType;
import com.sanctions.screening.domain.NormalizedEntity;
import com.sanctions.screening.domain.PolicyFlag;
import com.sanctions.screening.domain.PolicyFlags;
import com.sanctions.screening.domain.UpstreamSignals;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * REST API request body for screening one normalized entity.
 */
@Data
public class ScreeningRequestDto {

    /** Canonical name tokens from the upstream normalizer, e.g. ["ivan", "petrov"]. */
    @NotNull(message = "tokens are required")
    private List<String> tokens;

    private String language;
    private LocalDate dateOfBirth;
    /** TYPE:VALUE form, e.g. "INN:1234567890". */
    private List<String> identifiers;
    private EntityType entityType;
    private Set<PolicyFlag> policyFlags;

    /** Pre-filter verdict; false short-circuits to a SKIP decision. Defaults to true. */
    private Boolean shouldProcess;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double smartFilterConfidence;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double personConfidence;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double orgConfidence;

    public NormalizedEntity toEntity() {
        return NormalizedEntity.builder()
                .tokens(tokens)
                .language(language)
                .dateOfBirth(dateOfBirth)
                .identifiers(identifiers)
                .entityType(entityType)
                .policyFlags(policyFlags == null ? PolicyFlags.none() : PolicyFlags.of(policyFlags))
                .signals(UpstreamSignals.builder()
                        .shouldProcess(shouldProcess == null || shouldProcess)
                        .smartFilterConfidence(orZero(smartFilterConfidence))
                        .personConfidence(orZero(personConfidence))
                        .orgConfidence(orZero(orgConfidence))
                        .build())
                .build();
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
