package com.sanctions.screening.index;

import lombok.Value;

/**
 * A record that passed the surname filter, with the optional keys it also matched.
 */
@Value
public class BlockingHit {
    WatchlistRecord record;
    boolean initialMatched;
    boolean birthYearMatched;
}
