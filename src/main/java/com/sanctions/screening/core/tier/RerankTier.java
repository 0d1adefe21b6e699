package com.sanctions.screening.core.tier;

import com.sanctions.screening.domain.Candidate;
import com.sanctions.screening.domain.MatchedField;
import com.sanctions.screening.domain.NormalizedEntity;
import com.sanctions.screening.domain.RerankScores;
import com.sanctions.screening.domain.ScreeningTier;
import com.sanctions.screening.text.PhoneticEncoder;
import com.sanctions.screening.text.StringSimilarity;
import com.sanctions.screening.text.TextCanonicalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Tier3: combines edit distance, phonetic equality, exact identifier/DOB rules and (when present)
 * vector cosine into one confidence per candidate, then orders candidates best first.
 * A feature the request cannot produce (cosine for non-vector candidates, the exact rule for input
 * with neither identifiers nor DOB) drops out and its weight is spread over the others.
 * Ties prefer identifier and DOB evidence over name-only matches.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RerankTier implements Tier {

    static final Comparator<Candidate> RANKING = Comparator.comparingDouble(Candidate::getConfidence).reversed()
            .thenComparing(Comparator.comparingInt(Candidate::evidenceRank).reversed())
            .thenComparing(Candidate::getId);

    private final RerankWeights weights;

    @Override
    public ScreeningTier tier() {
        return ScreeningTier.RERANK;
    }

    @Override
    public TierResult run(TierRequest request) {
        long start = System.currentTimeMillis();
        if (request.getScope() != null) {
            request.getScope().throwIfCancelled();
        }
        NormalizedEntity entity = request.getEntity();
        String queryName = TextCanonicalizer.canonicalName(entity.getTokens());
        Set<String> queryCodes = phoneticCodes(entity.getTokens());
        Set<String> queryIds = canonicalIdentifiers(entity.identifiersOrEmpty());

        List<Candidate> reranked = new ArrayList<>(request.getCandidates().size());
        for (Candidate candidate : request.getCandidates()) {
            reranked.add(score(candidate, entity, queryName, queryCodes, queryIds));
        }
        reranked.sort(RANKING);

        long elapsed = System.currentTimeMillis() - start;
        log.debug("Tier3 reranked {} candidates in {}ms, top={}", reranked.size(), elapsed,
                reranked.isEmpty() ? null : reranked.get(0).getId());
        return TierResult.builder()
                .tier(tier())
                .candidates(reranked)
                .elapsedMs(elapsed)
                .build();
    }

    Candidate score(Candidate candidate, NormalizedEntity entity, String queryName,
                    Set<String> queryCodes, Set<String> queryIds) {
        List<String> names = new ArrayList<>();
        if (candidate.getMatchedText() != null) {
            names.add(candidate.getMatchedText());
        }
        if (candidate.getMetadata() != null) {
            names.addAll(candidate.getMetadata().aliasesOrEmpty());
        }

        double edit = 0.0;
        Set<String> recordCodes = new HashSet<>();
        for (String name : names) {
            String canonical = TextCanonicalizer.canonicalName(name);
            edit = Math.max(edit, StringSimilarity.nameSimilarity(queryName, canonical));
            recordCodes.addAll(phoneticCodes(List.of(canonical.split(" "))));
        }

        double phonetic = 0.0;
        if (!queryCodes.isEmpty()) {
            long shared = queryCodes.stream().filter(recordCodes::contains).count();
            phonetic = (double) shared / queryCodes.size();
        }

        Set<MatchedField> fields = candidate.getMatchedFields() == null || candidate.getMatchedFields().isEmpty()
                ? EnumSet.noneOf(MatchedField.class)
                : EnumSet.copyOf(candidate.getMatchedFields());
        boolean idMatch = fields.contains(MatchedField.IDENTIFIER)
                || candidate.getMetadata() != null && identifiersMatch(queryIds, candidate.getMetadata().identifiersOrEmpty());
        boolean dobMatch = entity.getDateOfBirth() != null && candidate.getMetadata() != null
                && entity.getDateOfBirth().equals(candidate.getMetadata().getDateOfBirth());
        if (idMatch) {
            fields.add(MatchedField.IDENTIFIER);
        }
        if (dobMatch) {
            fields.add(MatchedField.DOB);
        }
        double exact = idMatch || dobMatch ? 1.0 : 0.0;

        Double cosine = candidate.getSourceTier() == ScreeningTier.VECTOR.getLevel() ? candidate.getRawScore() : null;

        // exact-rule only counts when the input could have produced it; an ID found by Tier0 always counts
        boolean exactAvailable = entity.hasIdentifiers() || entity.hasDateOfBirth() || idMatch;
        double weighted = weights.getEditDistance() * edit + weights.getPhonetic() * phonetic;
        double total = weights.getEditDistance() + weights.getPhonetic();
        if (exactAvailable) {
            weighted += weights.getExactRule() * exact;
            total += weights.getExactRule();
        }
        if (cosine != null) {
            weighted += weights.getCosine() * cosine;
            total += weights.getCosine();
        }
        double confidence = total > 0.0 ? Math.max(0.0, Math.min(1.0, weighted / total)) : 0.0;

        return candidate.toBuilder()
                .matchedFields(fields)
                .confidence(confidence)
                .rerankScores(RerankScores.builder()
                        .editDistance(edit)
                        .phonetic(phonetic)
                        .exactRule(exact)
                        .cosine(cosine)
                        .build())
                .build();
    }

    static Set<String> phoneticCodes(List<String> tokens) {
        Set<String> codes = new HashSet<>();
        for (String token : tokens) {
            String code = PhoneticEncoder.encode(TextCanonicalizer.canonicalToken(token));
            if (!code.isEmpty()) {
                codes.add(code);
            }
        }
        return codes;
    }

    static Set<String> canonicalIdentifiers(List<String> identifiers) {
        Set<String> out = new HashSet<>();
        for (String id : identifiers) {
            String canonical = TextCanonicalizer.canonicalIdentifier(id);
            if (!canonical.isEmpty()) {
                out.add(canonical);
            }
        }
        return out;
    }

    /** Any query identifier naming the same document as a record identifier; types must agree when both are typed. */
    static boolean identifiersMatch(Set<String> queryIds, List<String> recordIds) {
        if (queryIds.isEmpty()) return false;
        for (String recordId : recordIds) {
            String canonical = TextCanonicalizer.canonicalIdentifier(recordId);
            for (String q : queryIds) {
                if (TextCanonicalizer.sameIdentifier(q, canonical)) {
                    return true;
                }
            }
        }
        return false;
    }
}
