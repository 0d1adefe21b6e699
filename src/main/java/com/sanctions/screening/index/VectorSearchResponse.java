package com.sanctions.screening.index;

import lombok.Value;

import java.util.List;

/**
 * kNN result. {@code partial} is set when the backend hit its deadline and returned
 * only what it had scanned so far.
 */
@Value
public class VectorSearchResponse {
    List<VectorHit> hits;
    boolean partial;

    public static VectorSearchResponse complete(List<VectorHit> hits) {
        return new VectorSearchResponse(hits, false);
    }

    public static VectorSearchResponse partial(List<VectorHit> hits) {
        return new VectorSearchResponse(hits, true);
    }
}
