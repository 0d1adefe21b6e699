package com.sanctions.screening.domain;

/**
 * Which part of the input contributed to a candidate match.
 */
public enum MatchedField {
    /** Full name or a registered alias. */
    NAME,
    /** Date of birth equal to the listed one. */
    DOB,
    /** Regulatory identifier (tax ID, passport, registration number). */
    IDENTIFIER
}
