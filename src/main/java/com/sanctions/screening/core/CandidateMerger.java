package com.sanctions.screening.core;

import com.sanctions.screening.domain.Candidate;
import com.sanctions.screening.domain.MatchedField;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Merges tier outputs so each watchlist id appears once.
 * The entry from the highest source tier wins (ties: higher raw score); matched fields are unioned.
 * Over the cap, source tiers take turns by tier-local rank instead of competing on raw score.
 */
public final class CandidateMerger {

    private static final Comparator<Candidate> PREFERENCE = Comparator.comparingInt(Candidate::getSourceTier)
            .thenComparingDouble(Candidate::getRawScore);

    private static final Comparator<Candidate> ORDER = Comparator.comparingDouble(Candidate::getRawScore).reversed()
            .thenComparing(Comparator.comparingInt(Candidate::getSourceTier).reversed())
            .thenComparing(Candidate::getId);

    private CandidateMerger() {}

    public static List<Candidate> merge(Collection<List<Candidate>> sources, int maxCandidates) {
        Map<String, Candidate> byId = new LinkedHashMap<>();
        for (List<Candidate> source : sources) {
            if (source == null) continue;
            for (Candidate candidate : source) {
                byId.merge(candidate.getId(), candidate, CandidateMerger::combine);
            }
        }
        List<Candidate> merged = byId.size() > maxCandidates
                ? capFairly(byId.values(), maxCandidates)
                : new ArrayList<>(byId.values());
        merged.sort(ORDER);
        return merged;
    }

    /**
     * Raw scores are only comparable within a tier, so the cap takes candidates round-robin by
     * tier-local rank: every contributing tier keeps its best candidates.
     */
    static List<Candidate> capFairly(Collection<Candidate> candidates, int maxCandidates) {
        Map<Integer, List<Candidate>> byTier = new TreeMap<>();
        for (Candidate candidate : candidates) {
            byTier.computeIfAbsent(candidate.getSourceTier(), t -> new ArrayList<>()).add(candidate);
        }
        for (List<Candidate> ranked : byTier.values()) {
            ranked.sort(ORDER);
        }
        List<Candidate> kept = new ArrayList<>(maxCandidates);
        for (int rank = 0; kept.size() < maxCandidates; rank++) {
            boolean any = false;
            for (List<Candidate> ranked : byTier.values()) {
                if (rank < ranked.size() && kept.size() < maxCandidates) {
                    kept.add(ranked.get(rank));
                    any = true;
                }
            }
            if (!any) break;
        }
        return kept;
    }

    private static Candidate combine(Candidate existing, Candidate incoming) {
        Candidate winner = PREFERENCE.compare(incoming, existing) > 0 ? incoming : existing;
        Set<MatchedField> fields = EnumSet.noneOf(MatchedField.class);
        if (existing.getMatchedFields() != null) fields.addAll(existing.getMatchedFields());
        if (incoming.getMatchedFields() != null) fields.addAll(incoming.getMatchedFields());
        return winner.toBuilder().matchedFields(fields).build();
    }
}
