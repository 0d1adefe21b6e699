package com.sanctions.screening.core.tier;

import com.sanctions.screening.api.ScreeningInternalException;
import lombok.Builder;
import lombok.Value;

/**
 * Feature weights of the reranker. When a candidate has no cosine score the remaining weights are
 * renormalised so confidences stay comparable.
 */
@Value
@Builder(toBuilder = true)
public class RerankWeights {

    @Builder.Default
    double editDistance = 0.35;
    @Builder.Default
    double phonetic = 0.15;
    @Builder.Default
    double exactRule = 0.30;
    @Builder.Default
    double cosine = 0.20;

    public static RerankWeights defaults() {
        return RerankWeights.builder().build();
    }

    public void validate() {
        double[] all = {editDistance, phonetic, exactRule, cosine};
        for (double w : all) {
            if (Double.isNaN(w) || w < 0.0 || w > 1.0) {
                throw new ScreeningInternalException("Rerank weight out of range [0,1]: " + w);
            }
        }
        if (editDistance + phonetic + exactRule <= 0.0) {
            throw new ScreeningInternalException("Rerank weights without cosine must not all be zero");
        }
    }
}
