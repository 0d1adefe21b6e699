package com.sanctions.screening.core.tier;

import com.sanctions.screening.api.ScreeningInternalException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Thresholds, limits and timeouts of the retrieval tiers. Bound from {@code screening.tiers.*}.
 */
@Value
@Builder(toBuilder = true)
public class TierSettings {

    @Builder.Default
    Duration requestBudget = Duration.ofMillis(250);

    /** Tier0 raw score at or above which the pipeline stops early. */
    @Builder.Default
    double exactThreshold = 0.95;
    @Builder.Default
    Duration exactTimeout = Duration.ofMillis(50);

    @Builder.Default
    boolean blockingEnabled = true;
    @Builder.Default
    int blockingLimit = 300;
    @Builder.Default
    int birthYearWindow = 1;
    @Builder.Default
    double escalationThreshold = 0.7;
    @Builder.Default
    double goodEnoughThreshold = 0.9;
    @Builder.Default
    Duration blockingTimeout = Duration.ofMillis(80);

    @Builder.Default
    boolean vectorEnabled = true;
    @Builder.Default
    int vectorTopK = 25;
    @Builder.Default
    double vectorMinScore = 0.3;
    @Builder.Default
    Duration vectorTimeout = Duration.ofMillis(60);
    /** Extra time the hard guard grants the backend to hand back a partial result. */
    @Builder.Default
    Duration vectorGrace = Duration.ofMillis(15);

    /** Cap on merged candidates handed to the reranker. */
    @Builder.Default
    int maxCandidates = 50;

    public static TierSettings defaults() {
        return TierSettings.builder().build();
    }

    public void validate() {
        if (escalationThreshold > goodEnoughThreshold) {
            throw new ScreeningInternalException("escalation-threshold (" + escalationThreshold
                    + ") must not exceed good-enough-threshold (" + goodEnoughThreshold + ")");
        }
        if (blockingLimit <= 0 || vectorTopK <= 0 || maxCandidates <= 0 || birthYearWindow < 0) {
            throw new ScreeningInternalException("Tier limits must be positive: blockingLimit=" + blockingLimit
                    + ", vectorTopK=" + vectorTopK + ", maxCandidates=" + maxCandidates
                    + ", birthYearWindow=" + birthYearWindow);
        }
        if (requestBudget.isNegative() || requestBudget.isZero()) {
            throw new ScreeningInternalException("request budget must be positive: " + requestBudget);
        }
    }
}
