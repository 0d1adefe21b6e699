package com.sanctions.screening.index;

import lombok.Builder;
import lombok.Value;

/**
 * Coarse filters for the blocking query. {@code surnameCode} is mandatory;
 * the initial and the birth-year window are optional and only scored.
 */
@Value
@Builder
public class BlockingKeys {

    String surnameCode;
    /** Lower-case first letter of the given name, or null. */
    String firstInitial;
    Integer birthYearFrom;
    Integer birthYearTo;

    public boolean hasInitial() {
        return firstInitial != null && !firstInitial.isEmpty();
    }

    public boolean hasBirthYear() {
        return birthYearFrom != null && birthYearTo != null;
    }

    /** Number of keys present, i.e. the denominator of the blocking confidence. */
    public int keyCount() {
        return 1 + (hasInitial() ? 1 : 0) + (hasBirthYear() ? 1 : 0);
    }
}
