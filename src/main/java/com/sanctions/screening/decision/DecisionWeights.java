package com.sanctions.screening.decision;

import com.sanctions.screening.api.ScreeningInternalException;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Score weights, bonuses and thresholds for {@link DecisionEngine}. Bound from
 * {@code screening.decision.*}; the defaults are only a starting point for tuning.
 */
@Value
@Builder(toBuilder = true)
public class DecisionWeights {

    @Builder.Default
    double smartfilter = 0.25;
    @Builder.Default
    double person = 0.30;
    @Builder.Default
    double org = 0.15;
    @Builder.Default
    double similarity = 0.25;
    @Builder.Default
    double bonusDobMatch = 0.07;
    @Builder.Default
    double bonusIdMatch = 0.15;
    @Builder.Default
    double bonusExactName = 0.10;
    @Builder.Default
    double thresholdHigh = 0.85;
    @Builder.Default
    double thresholdMedium = 0.65;
    /** Component value at or above which a signal is reported as strong. */
    @Builder.Default
    double strongSignal = 0.7;
    @Builder.Default
    double strongSimilarity = 0.9;

    public static DecisionWeights defaults() {
        return DecisionWeights.builder().build();
    }

    /**
     * Copy with the named values replaced. Keys use the same names as {@link #validate()} reports.
     *
     * @throws ScreeningInternalException for an unknown key or a missing value
     */
    public DecisionWeights withOverrides(Map<String, Double> overrides) {
        DecisionWeightsBuilder b = toBuilder();
        overrides.forEach((key, value) -> {
            if (value == null) {
                throw new ScreeningInternalException("Decision weight '" + key + "' has no value");
            }
            switch (key) {
                case "smartfilter": b.smartfilter(value); break;
                case "person": b.person(value); break;
                case "org": b.org(value); break;
                case "similarity": b.similarity(value); break;
                case "bonus-dob-match": b.bonusDobMatch(value); break;
                case "bonus-id-match": b.bonusIdMatch(value); break;
                case "bonus-exact-name": b.bonusExactName(value); break;
                case "threshold-high": b.thresholdHigh(value); break;
                case "threshold-medium": b.thresholdMedium(value); break;
                case "strong-signal": b.strongSignal(value); break;
                case "strong-similarity": b.strongSimilarity(value); break;
                default: throw new ScreeningInternalException("Unknown decision weight '" + key + "'");
            }
        });
        return b.build();
    }

    /**
     * @throws ScreeningInternalException if any value is outside [0,1] or the thresholds are inverted
     */
    public void validate() {
        requireUnit("smartfilter", smartfilter);
        requireUnit("person", person);
        requireUnit("org", org);
        requireUnit("similarity", similarity);
        requireUnit("bonus-dob-match", bonusDobMatch);
        requireUnit("bonus-id-match", bonusIdMatch);
        requireUnit("bonus-exact-name", bonusExactName);
        requireUnit("threshold-high", thresholdHigh);
        requireUnit("threshold-medium", thresholdMedium);
        requireUnit("strong-signal", strongSignal);
        requireUnit("strong-similarity", strongSimilarity);
        if (thresholdMedium > thresholdHigh) {
            throw new ScreeningInternalException("Decision threshold-medium (" + thresholdMedium
                    + ") must not exceed threshold-high (" + thresholdHigh + ")");
        }
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ScreeningInternalException("Decision weight '" + name + "' out of range [0,1]: " + value);
        }
    }
}
