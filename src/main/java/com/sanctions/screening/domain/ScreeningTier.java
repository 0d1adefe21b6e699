package com.sanctions.screening.domain;

/**
 * Stages of the screening pipeline, cheapest first.
 */
public enum ScreeningTier {
    EXACT(0, "exact"),
    BLOCKING(1, "blocking"),
    VECTOR(2, "vector"),
    RERANK(3, "rerank");

    private final int level;
    private final String code;

    ScreeningTier(int level, String code) {
        this.level = level;
        this.code = code;
    }

    public int getLevel() {
        return level;
    }

    /** Short lower-case name used in reason codes and logs. */
    public String getCode() {
        return code;
    }

    public static ScreeningTier fromLevel(int level) {
        for (ScreeningTier tier : values()) {
            if (tier.level == level) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown tier level: " + level);
    }
}
