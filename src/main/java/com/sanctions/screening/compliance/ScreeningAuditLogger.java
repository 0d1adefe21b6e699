package com.sanctions.screening.compliance;

import com.sanctions.screening.domain.Decision;
import com.sanctions.screening.domain.NormalizedEntity;
import com.sanctions.screening.domain.ScreeningResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Logs screening requests and decisions for compliance review. Identity data is masked;
 * the full decision trail goes to the {@code screening-decisions} topic.
 */
@Slf4j
@Component
public class ScreeningAuditLogger {

    public void logRequest(NormalizedEntity entity) {
        log.info("[AUDIT] SCREENING_REQUEST name={} type={} identifiers={} dobPresent={} flags={}",
                IdentifierMasker.maskName(entity.getTokens()),
                entity.typeOrDefault(),
                IdentifierMasker.maskIdentifiers(entity.identifiersOrEmpty()),
                entity.hasDateOfBirth(),
                entity.flags());
    }

    public void logDecision(ScreeningResult result) {
        Decision decision = result.getDecision();
        log.info("[AUDIT] SCREENING_DECISION requestId={} riskLevel={} riskScore={} reviewRequired={} "
                        + "requiredFields={} decisiveTier={} topCandidate={} cacheHit={} reasons={}",
                result.getRequestId(),
                decision.getRiskLevel(),
                decision.getRiskScore(),
                decision.isReviewRequired(),
                decision.getRequiredAdditionalFields(),
                decision.getDecisiveTier(),
                result.getCandidates().isEmpty() ? null : result.getCandidates().get(0).getId(),
                result.isCacheHit(),
                decision.getDecisionReasons());
    }
}
