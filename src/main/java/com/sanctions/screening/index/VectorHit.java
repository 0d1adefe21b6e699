package com.sanctions.screening.index;

import lombok.Value;

@Value
public class VectorHit {
    WatchlistRecord record;
    /** Cosine similarity in [0,1]. */
    double score;
}
