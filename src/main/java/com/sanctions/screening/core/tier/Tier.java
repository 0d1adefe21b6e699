package com.sanctions.screening.core.tier;

import com.sanctions.screening.domain.ScreeningTier;

/**
 * One stage of the screening pipeline. Implementations must not throw for backend trouble:
 * they report it on {@link TierResult#getError()} and contribute what they have.
 */
public interface Tier {

    ScreeningTier tier();

    TierResult run(TierRequest request);
}
