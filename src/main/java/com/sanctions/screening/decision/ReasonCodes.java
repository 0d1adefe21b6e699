package com.sanctions.screening.decision;

import com.sanctions.screening.domain.ScreeningTier;

/**
 * Reason codes emitted in {@code decision_reasons}. Downstream audit tooling matches on these strings.
 */
public final class ReasonCodes {

    public static final String SMARTFILTER_SKIP = "smartfilter_skip";

    public static final String STRONG_SMARTFILTER_SIGNAL = "strong_smartfilter_signal";
    public static final String SMARTFILTER_SIGNAL = "smartfilter_signal";
    public static final String PERSON_EVIDENCE_STRONG = "person_evidence_strong";
    public static final String PERSON_EVIDENCE = "person_evidence";
    public static final String ORG_EVIDENCE_STRONG = "org_evidence_strong";
    public static final String ORG_EVIDENCE = "org_evidence";
    public static final String HIGH_VECTOR_SIMILARITY = "high_vector_similarity";
    public static final String VECTOR_SIMILARITY = "vector_similarity";

    public static final String EXACT_NAME_MATCH = "exact_name_match";
    public static final String ID_EXACT_MATCH = "id_exact_match";
    public static final String DOB_MATCH = "dob_match";
    public static final String SANCTIONED_ID_MATCH = "sanctioned_id_match";

    public static final String CACHE_UNAVAILABLE = "cache_unavailable";
    public static final String ADDITIONAL_EVIDENCE_REQUIRED = "additional_evidence_required";
    public static final String EVIDENCE_MISMATCH = "evidence_mismatch";

    private ReasonCodes() {}

    public static String decisiveTier(ScreeningTier tier) {
        return "decisive_tier:" + tier.getCode();
    }

    public static String backendUnavailable(ScreeningTier tier) {
        return "backend_unavailable:" + tier.getCode();
    }
}
