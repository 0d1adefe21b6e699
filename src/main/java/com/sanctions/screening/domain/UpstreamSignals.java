package com.sanctions.screening.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Evidence produced by the pre-filter and entity classifiers that run before screening.
 * All confidences are in [0,1].
 */
@Value
@Builder(toBuilder = true)
public class UpstreamSignals {

    /** False when the pre-filter found nothing screenable; the decision is then {@code SKIP}. */
    @Builder.Default
    boolean shouldProcess = true;
    double smartFilterConfidence;
    double personConfidence;
    double orgConfidence;

    public static UpstreamSignals none() {
        return UpstreamSignals.builder().build();
    }
}
