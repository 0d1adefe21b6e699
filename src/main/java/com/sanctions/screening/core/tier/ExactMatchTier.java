package com.sanctions.screening.core.tier;

import com.sanctions.screening.domain.Candidate;
import com.sanctions.screening.domain.MatchedField;
import com.sanctions.screening.domain.NormalizedEntity;
import com.sanctions.screening.domain.ScreeningTier;
import com.sanctions.screening.index.BackendUnavailableException;
import com.sanctions.screening.index.ExactPattern;
import com.sanctions.screening.index.ExactPatternSource;
import com.sanctions.screening.index.WatchlistBackend;
import com.sanctions.screening.index.WatchlistRecord;
import com.sanctions.screening.text.TextCanonicalizer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Tier0: whole-string match of the canonical name and of each identifier against the compiled automaton,
 * then resolution of the matched patterns to watchlist records. Every hit scores 1.0.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExactMatchTier implements Tier {

    static final double EXACT_SCORE = 1.0;

    private final ExactPatternSource patternSource;
    private final WatchlistBackend backend;
    private final BackendCallExecutor callExecutor;
    private final TierSettings settings;

    private volatile AhoCorasickAutomaton automaton;

    /**
     * Compiles the automaton from the current patterns. Called again whenever the pattern source reloads.
     */
    @PostConstruct
    public void init() {
        long start = System.currentTimeMillis();
        automaton = AhoCorasickAutomaton.build(patternSource.exactPatterns());
        log.info("Exact-match automaton compiled: patterns={}, states={}, took={}ms",
                automaton.patternCount(), automaton.stateCount(), System.currentTimeMillis() - start);
    }

    @Override
    public ScreeningTier tier() {
        return ScreeningTier.EXACT;
    }

    @Override
    public TierResult run(TierRequest request) {
        long start = System.currentTimeMillis();
        NormalizedEntity entity = request.getEntity();

        String name = TextCanonicalizer.canonicalName(entity.getTokens());
        Set<String> nameKeys = new LinkedHashSet<>();
        automaton.matchWhole(name)
                .filter(p -> p.getKind() == MatchedField.NAME)
                .map(ExactPattern::getText)
                .ifPresent(nameKeys::add);

        Set<String> idKeys = new LinkedHashSet<>();
        List<String> matchedIds = new ArrayList<>();
        for (String identifier : entity.identifiersOrEmpty()) {
            String canonical = TextCanonicalizer.canonicalIdentifier(identifier);
            Optional<ExactPattern> hit = automaton.matchWhole(canonical)
                    .filter(p -> p.getKind() == MatchedField.IDENTIFIER)
                    .or(() -> automaton.matchWhole(TextCanonicalizer.identifierValue(canonical))
                            .filter(p -> p.getKind() == MatchedField.IDENTIFIER));
            if (hit.isPresent()) {
                idKeys.add(hit.get().getText());
                matchedIds.add(canonical);
            }
        }

        if (nameKeys.isEmpty() && idKeys.isEmpty()) {
            log.debug("Tier0 no exact pattern for name='{}' identifiers={}", name, entity.identifiersOrEmpty().size());
            return TierResult.builder()
                    .tier(tier())
                    .elapsedMs(System.currentTimeMillis() - start)
                    .escalate(true)
                    .build();
        }

        List<String> keys = new ArrayList<>(nameKeys);
        keys.addAll(idKeys);
        List<WatchlistRecord> records;
        try {
            records = callExecutor.call("exactLookup",
                    request.getBudget().timeoutFor(settings.getExactTimeout()),
                    request.getScope(),
                    () -> backend.exactLookup(keys));
        } catch (BackendUnavailableException e) {
            log.warn("Tier0 exact lookup unavailable: {}", e.getMessage());
            return TierResult.failed(tier(), System.currentTimeMillis() - start, e.getMessage());
        }

        List<Candidate> candidates = new ArrayList<>(records.size());
        for (WatchlistRecord record : records) {
            Set<MatchedField> fields = EnumSet.noneOf(MatchedField.class);
            if (matchesName(record, nameKeys)) {
                fields.add(MatchedField.NAME);
            }
            if (matchesIdentifier(record, matchedIds)) {
                fields.add(MatchedField.IDENTIFIER);
            }
            if (fields.isEmpty()) {
                continue;
            }
            candidates.add(CandidateMapper.toCandidate(record, tier(), EXACT_SCORE, fields));
        }
        candidates.sort(Comparator.comparing(Candidate::getId));

        long elapsed = System.currentTimeMillis() - start;
        log.debug("Tier0 matched nameKeys={} idKeys={} candidates={} in {}ms",
                nameKeys.size(), idKeys.size(), candidates.size(), elapsed);
        return TierResult.builder()
                .tier(tier())
                .candidates(candidates)
                .elapsedMs(elapsed)
                .escalate(candidates.isEmpty())
                .build();
    }

    private static boolean matchesName(WatchlistRecord record, Set<String> nameKeys) {
        if (nameKeys.isEmpty()) return false;
        List<String> names = new ArrayList<>(record.aliasesOrEmpty());
        if (record.getName() != null) {
            names.add(record.getName());
        }
        for (String n : names) {
            String canonical = TextCanonicalizer.canonicalName(n);
            if (nameKeys.contains(canonical)) {
                return true;
            }
            String sorted = TextCanonicalizer.tokenSorted(canonical);
            for (String key : nameKeys) {
                if (TextCanonicalizer.tokenSorted(key).equals(sorted)) {
                    return true;
                }
            }
        }
        return false;
    }

    /** A bare-value hit only counts when the types agree or one side is untyped. */
    private static boolean matchesIdentifier(WatchlistRecord record, List<String> queryIds) {
        if (queryIds.isEmpty()) return false;
        for (String identifier : record.identifiersOrEmpty()) {
            String canonical = TextCanonicalizer.canonicalIdentifier(identifier);
            for (String query : queryIds) {
                if (TextCanonicalizer.sameIdentifier(query, canonical)) {
                    return true;
                }
            }
        }
        return false;
    }
}
