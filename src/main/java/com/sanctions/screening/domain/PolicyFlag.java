package com.sanctions.screening.domain;

/**
 * Per-request feature toggles. Each component reads only the flags it cares about.
 */
public enum PolicyFlag {
    /** Drop honorifics, legal-form words and single letters before key and vector generation. */
    STRICT_STOPWORDS,
    /** Skip Cyrillic transliteration when every token is plain ASCII. */
    ASCII_FASTPATH,
    /** Do not run the blocking tier. */
    DISABLE_BLOCKING,
    /** Do not run the vector tier. */
    DISABLE_VECTOR,
    /** Run the vector tier regardless of the blocking confidence. */
    FORCE_VECTOR,
    /** Neither read nor write the result cache. */
    NO_CACHE,
    /** Debug tracing; implies cache bypass so every tier actually executes. */
    DEBUG_TRACE,
    /** Re-run the pipeline in the background with forced escalation and log divergence. */
    SHADOW_MODE
}
