package com.sanctions.screening.api;

import com.sanctions.screening.domain.Candidate;
import com.sanctions.screening.domain.Decision;
import com.sanctions.screening.domain.RequiredField;
import com.sanctions.screening.domain.RiskLevel;
import com.sanctions.screening.domain.ScoreBreakdown;
import com.sanctions.screening.domain.ScreeningResult;
import com.sanctions.screening.domain.ScreeningTier;
import com.sanctions.screening.domain.TierDiagnostic;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST API response for one screening.
 */
@Value
@Builder
public class ScreeningResponseDto {

    String requestId;
    RiskLevel riskLevel;
    double riskScore;
    boolean reviewRequired;
    List<RequiredField> requiredAdditionalFields;
    List<String> decisionReasons;
    ScreeningTier decisiveTier;
    ScoreBreakdown scoreBreakdown;
    Map<String, Double> contributions;
    List<Candidate> candidates;
    List<TierDiagnostic> tierDiagnostics;
    List<ScreeningTier> tiersExecuted;
    boolean earlyStopped;
    boolean cacheHit;
    long elapsedMs;
    Instant screenedAt;

    public static ScreeningResponseDto from(ScreeningResult result) {
        if (result == null) {
            throw new IllegalArgumentException("ScreeningResult cannot be null");
        }
        Decision decision = result.getDecision();
        return ScreeningResponseDto.builder()
                .requestId(result.getRequestId())
                .riskLevel(decision.getRiskLevel())
                .riskScore(decision.getRiskScore())
                .reviewRequired(decision.isReviewRequired())
                .requiredAdditionalFields(decision.getRequiredAdditionalFields())
                .decisionReasons(decision.getDecisionReasons())
                .decisiveTier(decision.getDecisiveTier())
                .scoreBreakdown(decision.getScoreBreakdown())
                .contributions(decision.getContributions())
                .candidates(result.getCandidates())
                .tierDiagnostics(result.getTierDiagnostics())
                .tiersExecuted(result.getTiersExecuted())
                .earlyStopped(result.isEarlyStopped())
                .cacheHit(result.isCacheHit())
                .elapsedMs(result.getElapsedMs())
                .screenedAt(result.getScreenedAt())
                .build();
    }
}
