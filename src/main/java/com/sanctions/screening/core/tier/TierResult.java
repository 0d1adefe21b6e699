package com.sanctions.screening.core.tier;

import com.sanctions.screening.domain.Candidate;
import com.sanctions.screening.domain.ScreeningTier;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one tier invocation. Consumed immediately by the orchestrator, never persisted.
 */
@Value
@Builder
public class TierResult {

    ScreeningTier tier;
    @Builder.Default
    List<Candidate> candidates = List.of();
    long elapsedMs;
    boolean escalate;
    TierError error;

    public boolean hasError() {
        return error != null;
    }

    public double bestRawScore() {
        return candidates.stream().mapToDouble(Candidate::getRawScore).max().orElse(0.0);
    }

    public static TierResult failed(ScreeningTier tier, long elapsedMs, String message) {
        return TierResult.builder()
                .tier(tier)
                .elapsedMs(elapsedMs)
                .escalate(true)
                .error(TierError.backendUnavailable(message))
                .build();
    }
}
