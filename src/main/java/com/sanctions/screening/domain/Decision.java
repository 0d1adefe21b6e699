package com.sanctions.screening.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Final classification of one screening.
 */
@Value
@Builder
@Jacksonized
public class Decision {

    RiskLevel riskLevel;
    double riskScore;
    boolean reviewRequired;
    List<RequiredField> requiredAdditionalFields;
    /** Ordered, de-duplicated reason codes. Stable for identical inputs. */
    List<String> decisionReasons;
    ScoreBreakdown scoreBreakdown;
    /** Weighted contribution of each component, in evaluation order. */
    Map<String, Double> contributions;
    ScreeningTier decisiveTier;
}
