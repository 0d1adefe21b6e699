package com.sanctions.screening.index;

import com.sanctions.screening.text.SparseVector;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * Narrow query interface to the index/storage engine holding the watchlist.
 * Implementations return raw records; turning them into candidates is the pipeline's job.
 * Any failure may be reported as {@link BackendUnavailableException}.
 */
public interface WatchlistBackend {

    /**
     * Name used for circuit breakers and logs.
     */
    default String getBackendName() {
        return this.getClass().getSimpleName();
    }

    /**
     * Records whose canonical name, alias or identifier equals one of the given canonical strings.
     */
    List<WatchlistRecord> exactLookup(Collection<String> tokens);

    /**
     * Records whose name or alias phonetic codes contain {@code keys.surnameCode}, at most {@code limit} of them,
     * annotated with which optional keys they also match. Ordering is by number of matched keys, then id.
     */
    List<BlockingHit> blockingSearch(BlockingKeys keys, int limit);

    /**
     * Top-{@code k} records by cosine similarity to {@code vector}. Must return within {@code timeout},
     * flagging the response as partial when the scan was cut short.
     */
    VectorSearchResponse vectorSearch(SparseVector vector, int k, Duration timeout);

    default boolean isHealthy() {
        return true;
    }
}
