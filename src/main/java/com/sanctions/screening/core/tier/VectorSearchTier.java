package com.sanctions.screening.core.tier;

import com.sanctions.screening.domain.Candidate;
import com.sanctions.screening.domain.MatchedField;
import com.sanctions.screening.domain.NormalizedEntity;
import com.sanctions.screening.domain.PolicyFlag;
import com.sanctions.screening.domain.ScreeningTier;
import com.sanctions.screening.index.BackendUnavailableException;
import com.sanctions.screening.index.VectorHit;
import com.sanctions.screening.index.VectorSearchResponse;
import com.sanctions.screening.index.WatchlistBackend;
import com.sanctions.screening.text.NgramVectorizer;
import com.sanctions.screening.text.SparseVector;
import com.sanctions.screening.text.TextCanonicalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Tier2: n-gram cosine kNN. The most expensive path, so the backend gets the strictest timeout
 * (bounded by what is left of the request budget). A late backend yields what it retrieved so far
 * plus an error; a backend that does not answer at all yields no candidates plus an error.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VectorSearchTier implements Tier {

    private final WatchlistBackend backend;
    private final BackendCallExecutor callExecutor;
    private final NgramVectorizer vectorizer;
    private final TierSettings settings;

    @Override
    public ScreeningTier tier() {
        return ScreeningTier.VECTOR;
    }

    @Override
    public TierResult run(TierRequest request) {
        long start = System.currentTimeMillis();
        NormalizedEntity entity = request.getEntity();
        List<String> tokens = entity.flags().has(PolicyFlag.STRICT_STOPWORDS)
                ? TextCanonicalizer.withoutStopwords(entity.getTokens())
                : entity.getTokens();
        SparseVector vector = vectorizer.vectorize(tokens);
        if (vector.isEmpty()) {
            return TierResult.builder().tier(tier()).elapsedMs(System.currentTimeMillis() - start).build();
        }

        Duration timeout = request.getBudget().timeoutFor(settings.getVectorTimeout());
        if (timeout.isZero()) {
            log.warn("Tier2 skipped: request budget exhausted");
            return TierResult.failed(tier(), System.currentTimeMillis() - start, "vectorSearch: latency budget exhausted");
        }
        Duration hardLimit = timeout.plus(settings.getVectorGrace());

        VectorSearchResponse response;
        try {
            response = callExecutor.call("vectorSearch", hardLimit, request.getScope(),
                    () -> backend.vectorSearch(vector, settings.getVectorTopK(), timeout));
        } catch (BackendUnavailableException e) {
            log.warn("Tier2 vector search unavailable, degrading to no vector candidates: {}", e.getMessage());
            return TierResult.failed(tier(), System.currentTimeMillis() - start, e.getMessage());
        }

        List<Candidate> candidates = new ArrayList<>();
        List<VectorHit> hits = response.getHits() != null ? response.getHits() : List.of();
        for (VectorHit hit : hits) {
            double score = Math.max(0.0, Math.min(1.0, hit.getScore()));
            if (score < settings.getVectorMinScore()) {
                continue;
            }
            candidates.add(CandidateMapper.toCandidate(hit.getRecord(), tier(), score, EnumSet.of(MatchedField.NAME)));
        }

        long elapsed = System.currentTimeMillis() - start;
        TierResult.TierResultBuilder result = TierResult.builder()
                .tier(tier())
                .candidates(candidates)
                .elapsedMs(elapsed);
        if (response.isPartial()) {
            log.warn("Tier2 returned partial result after {}ms: hits={}", elapsed, candidates.size());
            result.error(TierError.partialResult("vectorSearch: deadline reached, partial result"));
        } else {
            log.debug("Tier2 hits={} kept={} in {}ms", hits.size(), candidates.size(), elapsed);
        }
        return result.build();
    }
}
