package com.sanctions.screening.domain;

/**
 * Coarse outcome of a screening. Drives the downstream business action.
 */
public enum RiskLevel {
    HIGH,
    MEDIUM,
    LOW,
    /** Pre-filter judged the input to contain no identifiable entity. */
    SKIP;

    public String getCode() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
