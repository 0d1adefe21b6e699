package com.sanctions.screening.domain;

/**
 * Evidence a reviewer must collect before a high-risk decision can be closed.
 */
public enum RequiredField {
    /** Taxpayer or other regulatory identifier. */
    TIN,
    DOB
}
