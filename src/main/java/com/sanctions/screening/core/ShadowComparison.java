package com.sanctions.screening.core;

import com.sanctions.screening.domain.RiskLevel;
import lombok.Value;

/**
 * Primary vs shadow outcome of one request.
 */
@Value
public class ShadowComparison {
    String requestId;
    RiskLevel primaryLevel;
    RiskLevel shadowLevel;
    double primaryScore;
    double shadowScore;
    String primaryTopId;
    String shadowTopId;

    public boolean isDiverged() {
        return primaryLevel != shadowLevel
                || Math.abs(primaryScore - shadowScore) > 1e-6
                || !java.util.Objects.equals(primaryTopId, shadowTopId);
    }
}
