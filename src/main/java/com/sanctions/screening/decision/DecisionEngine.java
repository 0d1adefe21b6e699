package com.sanctions.screening.decision;

import com.sanctions.screening.api.ScreeningInternalException;
import com.sanctions.screening.domain.Decision;
import com.sanctions.screening.domain.RequiredField;
import com.sanctions.screening.domain.RiskLevel;
import com.sanctions.screening.domain.ScoreBreakdown;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Fuses score components into a risk level, a review flag and an ordered explanation.
 * Pure: no I/O, no clock, no randomness. Identical evidence under the same weights always yields an identical
 * decision. Weights can be swapped at runtime through {@link #updateWeights}.
 */
@Slf4j
@Service
public class DecisionEngine {

    private volatile DecisionWeights weights;

    public DecisionEngine(DecisionWeights weights) {
        this.weights = weights;
    }

    public Decision decide(DecisionEvidence evidence) {
        DecisionWeights w = weights;
        w.validate();
        if (evidence == null || evidence.getBreakdown() == null) {
            throw new ScreeningInternalException("Decision evidence without score breakdown");
        }
        ScoreBreakdown b = evidence.getBreakdown();

        if (!evidence.isShouldProcess()) {
            return Decision.builder()
                    .riskLevel(RiskLevel.SKIP)
                    .riskScore(0.0)
                    .reviewRequired(false)
                    .requiredAdditionalFields(List.of())
                    .decisionReasons(List.of(ReasonCodes.SMARTFILTER_SKIP))
                    .scoreBreakdown(b)
                    .contributions(Map.of())
                    .decisiveTier(evidence.getDecisiveTier())
                    .build();
        }

        requireUnit("smartfilter_signal", b.getSmartfilterSignal());
        requireUnit("person_evidence", b.getPersonEvidence());
        requireUnit("org_evidence", b.getOrgEvidence());
        requireUnit("similarity_top", b.getSimilarityTop());

        Map<String, Double> contributions = new LinkedHashMap<>();
        contributions.put("smartfilter_signal", w.getSmartfilter() * b.getSmartfilterSignal());
        contributions.put("person_evidence", w.getPerson() * b.getPersonEvidence());
        contributions.put("org_evidence", w.getOrg() * b.getOrgEvidence());
        contributions.put("similarity_top", w.getSimilarity() * b.getSimilarityTop());
        contributions.put("exact_name_match", b.isExactNameMatch() ? w.getBonusExactName() : 0.0);
        contributions.put("id_exact_match", b.isIdExactMatch() ? w.getBonusIdMatch() : 0.0);
        contributions.put("dob_match", b.isDobMatch() ? w.getBonusDobMatch() : 0.0);

        double sum = 0.0;
        for (double c : contributions.values()) {
            sum += c;
        }
        double score = clamp(sum);
        // an exact hit on a sanctioned identifier is conclusive on its own
        if (b.isIdExactMatch()) {
            score = Math.max(score, w.getThresholdHigh());
        }

        RiskLevel level = score >= w.getThresholdHigh() ? RiskLevel.HIGH
                : score >= w.getThresholdMedium() ? RiskLevel.MEDIUM
                : RiskLevel.LOW;

        boolean evidenceClosed = b.isIdExactMatch() || b.isDobMatch();
        boolean reviewRequired = level == RiskLevel.HIGH && !evidenceClosed;
        List<RequiredField> required = new ArrayList<>();
        boolean mismatch = false;
        if (reviewRequired) {
            if (!evidence.isInputHasIdentifiers()) {
                required.add(RequiredField.TIN);
            }
            if (!evidence.isInputHasDateOfBirth()) {
                required.add(RequiredField.DOB);
            }
            if (required.isEmpty()) {
                // both supplied, neither matched: ask for both to be re-verified
                required.add(RequiredField.TIN);
                required.add(RequiredField.DOB);
                mismatch = true;
            }
        }

        List<String> reasons = buildReasons(w, evidence, b, level, score, reviewRequired, mismatch);
        log.debug("Decision computed: level={}, score={}, review={}, required={}, reasons={}",
                level, score, reviewRequired, required, reasons);

        return Decision.builder()
                .riskLevel(level)
                .riskScore(score)
                .reviewRequired(reviewRequired)
                .requiredAdditionalFields(Collections.unmodifiableList(required))
                .decisionReasons(reasons)
                .scoreBreakdown(b)
                .contributions(Collections.unmodifiableMap(contributions))
                .decisiveTier(evidence.getDecisiveTier())
                .build();
    }

    public DecisionWeights getWeights() {
        return weights;
    }

    /**
     * Swaps the weights used by subsequent decisions. A decision already running finishes with the old ones.
     *
     * @throws ScreeningInternalException if {@code next} is invalid; the current weights stay in place
     */
    public void updateWeights(DecisionWeights next) {
        next.validate();
        DecisionWeights previous = weights;
        weights = next;
        log.info("Decision weights updated: {} -> {}", previous, next);
    }

    private List<String> buildReasons(DecisionWeights w, DecisionEvidence evidence, ScoreBreakdown b,
                                      RiskLevel level, double score, boolean reviewRequired, boolean mismatch) {
        Set<String> reasons = new LinkedHashSet<>();
        addComponent(reasons, b.getSmartfilterSignal(), w.getStrongSignal(),
                ReasonCodes.STRONG_SMARTFILTER_SIGNAL, ReasonCodes.SMARTFILTER_SIGNAL);
        addComponent(reasons, b.getPersonEvidence(), w.getStrongSignal(),
                ReasonCodes.PERSON_EVIDENCE_STRONG, ReasonCodes.PERSON_EVIDENCE);
        addComponent(reasons, b.getOrgEvidence(), w.getStrongSignal(),
                ReasonCodes.ORG_EVIDENCE_STRONG, ReasonCodes.ORG_EVIDENCE);
        addComponent(reasons, b.getSimilarityTop(), w.getStrongSimilarity(),
                ReasonCodes.HIGH_VECTOR_SIMILARITY, ReasonCodes.VECTOR_SIMILARITY);
        if (b.isExactNameMatch()) {
            reasons.add(ReasonCodes.EXACT_NAME_MATCH);
        }
        if (b.isIdExactMatch()) {
            reasons.add(ReasonCodes.ID_EXACT_MATCH);
        }
        if (b.isDobMatch()) {
            reasons.add(ReasonCodes.DOB_MATCH);
        }
        if (b.isIdExactMatch()) {
            reasons.add(ReasonCodes.SANCTIONED_ID_MATCH);
        }
        if (evidence.getDecisiveTier() != null) {
            reasons.add(ReasonCodes.decisiveTier(evidence.getDecisiveTier()));
        }
        if (evidence.getDegradations() != null) {
            reasons.addAll(evidence.getDegradations());
        }
        if (reviewRequired) {
            reasons.add(ReasonCodes.ADDITIONAL_EVIDENCE_REQUIRED);
        }
        if (mismatch) {
            reasons.add(ReasonCodes.EVIDENCE_MISMATCH);
        }
        reasons.add(String.format(Locale.ROOT, "risk_score=%.3f", score));
        reasons.add("risk_level=" + level.getCode());
        return List.copyOf(reasons);
    }

    private static void addComponent(Set<String> reasons, double value, double strongAt, String strong, String plain) {
        if (value <= 0.0) return;
        reasons.add(value >= strongAt ? strong : plain);
    }

    private static void requireUnit(String component, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ScreeningInternalException("Score component '" + component + "' out of range [0,1]: " + value);
        }
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
