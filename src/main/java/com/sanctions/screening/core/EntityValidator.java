package com.sanctions.screening.core;

import com.sanctions.screening.api.MalformedInputException;
import com.sanctions.screening.domain.NormalizedEntity;
import com.sanctions.screening.domain.UpstreamSignals;

/**
 * Rejects entities the pipeline cannot produce a safe decision for.
 */
public final class EntityValidator {

    private EntityValidator() {}

    /**
     * @throws MalformedInputException describing the first problem found
     */
    public static void validate(NormalizedEntity entity) {
        if (entity == null) {
            throw new MalformedInputException("entity is required");
        }
        if (entity.getTokens() == null) {
            throw new MalformedInputException("tokens are required");
        }
        UpstreamSignals signals = entity.signalsOrDefault();
        if (signals.isShouldProcess() && entity.getTokens().isEmpty()) {
            throw new MalformedInputException("tokens must not be empty");
        }
        for (int i = 0; i < entity.getTokens().size(); i++) {
            String token = entity.getTokens().get(i);
            if (token == null || token.isBlank()) {
                throw new MalformedInputException("token[" + i + "] is blank");
            }
        }
        for (String identifier : entity.identifiersOrEmpty()) {
            if (identifier == null || identifier.isBlank()) {
                throw new MalformedInputException("identifiers must not contain blank values");
            }
        }
        requireUnit("smartFilterConfidence", signals.getSmartFilterConfidence());
        requireUnit("personConfidence", signals.getPersonConfidence());
        requireUnit("orgConfidence", signals.getOrgConfidence());
    }

    private static void requireUnit(String field, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new MalformedInputException(field + " must be within [0,1] but was " + value);
        }
    }
}
