package com.sanctions.screening.index;

import com.sanctions.screening.domain.MatchedField;
import com.sanctions.screening.text.NgramVectorizer;
import com.sanctions.screening.text.PhoneticEncoder;
import com.sanctions.screening.text.SparseVector;
import com.sanctions.screening.text.TextCanonicalizer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reference {@link WatchlistBackend} over an in-memory corpus. Useful for demos, tests and small lists;
 * production deployments plug in an adapter for their search cluster instead.
 * Index structures live in an immutable {@link Snapshot}; {@link #replace} builds a new one and swaps it in,
 * so every call works against a single consistent corpus.
 */
@Slf4j
public class InMemoryWatchlistBackend implements WatchlistBackend, ExactPatternSource, ReloadableWatchlist {

    /** How many records the vector scan processes between deadline checks. */
    private static final int DEADLINE_CHECK_INTERVAL = 32;

    private final NgramVectorizer vectorizer;
    private final Clock clock;
    private final AtomicLong generation = new AtomicLong();
    private volatile Snapshot snapshot;

    public InMemoryWatchlistBackend(List<WatchlistRecord> records, NgramVectorizer vectorizer) {
        this(records, vectorizer, "inline", Clock.systemUTC());
    }

    public InMemoryWatchlistBackend(List<WatchlistRecord> records, NgramVectorizer vectorizer, String source,
                                    Clock clock) {
        this.vectorizer = vectorizer;
        this.clock = clock;
        this.snapshot = build(records, source);
    }

    @Override
    public String getBackendName() {
        return "in-memory";
    }

    @Override
    public synchronized WatchlistStatus replace(List<WatchlistRecord> records, String source) {
        Snapshot next = build(records, source);
        snapshot = next;
        return statusOf(next);
    }

    @Override
    public WatchlistStatus status() {
        return statusOf(snapshot);
    }

    @Override
    public Collection<ExactPattern> exactPatterns() {
        return snapshot.patterns;
    }

    @Override
    public List<WatchlistRecord> exactLookup(Collection<String> tokens) {
        Snapshot s = snapshot;
        Map<String, WatchlistRecord> found = new LinkedHashMap<>();
        for (String token : tokens) {
            for (WatchlistRecord record : s.byPattern.getOrDefault(token, List.of())) {
                found.putIfAbsent(record.getId(), record);
            }
        }
        return new ArrayList<>(found.values());
    }

    @Override
    public List<BlockingHit> blockingSearch(BlockingKeys keys, int limit) {
        Snapshot s = snapshot;
        Set<Integer> matches = s.byPhoneticCode.getOrDefault(keys.getSurnameCode(), Set.of());
        List<BlockingHit> hits = new ArrayList<>(matches.size());
        for (int idx : matches) {
            WatchlistRecord record = s.records.get(idx);
            boolean initialMatched = keys.hasInitial() && s.initials.get(idx).contains(keys.getFirstInitial());
            boolean yearMatched = keys.hasBirthYear() && record.getDateOfBirth() != null
                    && record.getDateOfBirth().getYear() >= keys.getBirthYearFrom()
                    && record.getDateOfBirth().getYear() <= keys.getBirthYearTo();
            hits.add(new BlockingHit(record, initialMatched, yearMatched));
        }
        hits.sort(Comparator.comparingInt(InMemoryWatchlistBackend::matchedOptionalKeys).reversed()
                .thenComparing(h -> h.getRecord().getId()));
        return hits.size() > limit ? new ArrayList<>(hits.subList(0, limit)) : hits;
    }

    @Override
    public VectorSearchResponse vectorSearch(SparseVector vector, int k, Duration timeout) {
        Snapshot s = snapshot;
        long deadline = System.nanoTime() + timeout.toNanos();
        SparseVector query = vector.reweighted(s::idfOf).normalized();
        Comparator<VectorHit> worstFirst = Comparator.comparingDouble(VectorHit::getScore)
                .thenComparing(h -> h.getRecord().getId(), Comparator.reverseOrder());
        PriorityQueue<VectorHit> top = new PriorityQueue<>(worstFirst);
        boolean partial = false;

        for (int i = 0; i < s.records.size(); i++) {
            if (i % DEADLINE_CHECK_INTERVAL == 0 && i > 0
                    && (System.nanoTime() > deadline || Thread.currentThread().isInterrupted())) {
                partial = true;
                log.debug("Vector scan cut short at {}/{} records", i, s.records.size());
                break;
            }
            double best = 0.0;
            for (SparseVector doc : s.nameVectors.get(i)) {
                best = Math.max(best, query.cosine(doc));
            }
            if (best <= 0.0) {
                continue;
            }
            top.offer(new VectorHit(s.records.get(i), best));
            if (top.size() > k) {
                top.poll();
            }
        }

        List<VectorHit> hits = new ArrayList<>(top);
        hits.sort(worstFirst.reversed());
        return partial ? VectorSearchResponse.partial(hits) : VectorSearchResponse.complete(hits);
    }

    public int size() {
        return snapshot.records.size();
    }

    private WatchlistStatus statusOf(Snapshot s) {
        return WatchlistStatus.builder()
                .backendName(getBackendName())
                .source(s.source)
                .records(s.records.size())
                .patterns(s.patterns.size())
                .generation(s.generation)
                .loadedAt(s.loadedAt)
                .build();
    }

    private Snapshot build(List<WatchlistRecord> records, String source) {
        Snapshot s = new Snapshot(records, vectorizer, source, generation.incrementAndGet(), clock.instant());
        log.info("In-memory watchlist indexed: source={}, generation={}, records={}, patterns={}, phoneticCodes={}",
                source, s.generation, s.records.size(), s.patterns.size(), s.byPhoneticCode.size());
        return s;
    }

    private static List<String> namesOf(WatchlistRecord record) {
        List<String> names = new ArrayList<>();
        if (record.getName() != null) {
            names.add(record.getName());
        }
        names.addAll(record.aliasesOrEmpty());
        return names;
    }

    private static int matchedOptionalKeys(BlockingHit hit) {
        return (hit.isInitialMatched() ? 1 : 0) + (hit.isBirthYearMatched() ? 1 : 0);
    }

    /**
     * One fully built index. Never mutated after construction.
     */
    private static final class Snapshot {
        private final List<WatchlistRecord> records;
        private final String source;
        private final long generation;
        private final Instant loadedAt;
        private final Map<String, List<WatchlistRecord>> byPattern = new HashMap<>();
        private final List<ExactPattern> patterns = new ArrayList<>();
        private final Map<String, Set<Integer>> byPhoneticCode = new HashMap<>();
        private final List<Set<String>> initials = new ArrayList<>();
        private final List<List<SparseVector>> nameVectors = new ArrayList<>();
        private final Map<String, Double> idf = new HashMap<>();
        private final double unseenIdf;

        Snapshot(List<WatchlistRecord> records, NgramVectorizer vectorizer, String source, long generation,
                 Instant loadedAt) {
            this.records = List.copyOf(records);
            this.source = source;
            this.generation = generation;
            this.loadedAt = loadedAt;

            Map<String, Integer> documentFrequency = new HashMap<>();
            List<List<SparseVector>> rawVectors = new ArrayList<>();
            int documents = 0;
            for (int i = 0; i < this.records.size(); i++) {
                WatchlistRecord record = this.records.get(i);
                indexPatterns(record);
                Set<String> recordInitials = new HashSet<>();
                List<SparseVector> vectors = new ArrayList<>();
                for (String name : namesOf(record)) {
                    List<String> tokens = List.of(TextCanonicalizer.canonicalName(name).split(" "));
                    for (String token : tokens) {
                        String code = PhoneticEncoder.encode(token);
                        if (!code.isEmpty()) {
                            byPhoneticCode.computeIfAbsent(code, k -> new LinkedHashSet<>()).add(i);
                        }
                        String initial = TextCanonicalizer.initial(token);
                        if (initial != null) {
                            recordInitials.add(initial);
                        }
                    }
                    SparseVector v = vectorizer.vectorize(tokens);
                    vectors.add(v);
                    v.weights().keySet().forEach(f -> documentFrequency.merge(f, 1, Integer::sum));
                    documents++;
                }
                initials.add(recordInitials);
                rawVectors.add(vectors);
            }

            final int n = documents;
            documentFrequency.forEach((feature, df) -> idf.put(feature, Math.log((n + 1.0) / (df + 1.0)) + 1.0));
            this.unseenIdf = Math.log(n + 1.0) + 1.0;
            for (List<SparseVector> vectors : rawVectors) {
                List<SparseVector> weighted = new ArrayList<>(vectors.size());
                for (SparseVector v : vectors) {
                    weighted.add(v.reweighted(this::idfOf).normalized());
                }
                nameVectors.add(weighted);
            }
        }

        private void indexPatterns(WatchlistRecord record) {
            for (String name : namesOf(record)) {
                String canonical = TextCanonicalizer.canonicalName(name);
                if (canonical.isEmpty()) continue;
                addPattern(canonical, MatchedField.NAME, record);
                String[] parts = canonical.split(" ");
                if (parts.length > 1) {
                    // surname-first ordering, e.g. "petrov ivan"
                    StringBuilder rotated = new StringBuilder(parts[parts.length - 1]);
                    for (int i = 0; i < parts.length - 1; i++) {
                        rotated.append(' ').append(parts[i]);
                    }
                    addPattern(rotated.toString(), MatchedField.NAME, record);
                }
            }
            for (String identifier : record.identifiersOrEmpty()) {
                String canonical = TextCanonicalizer.canonicalIdentifier(identifier);
                if (canonical.isEmpty()) continue;
                addPattern(canonical, MatchedField.IDENTIFIER, record);
                String value = TextCanonicalizer.identifierValue(canonical);
                if (!value.equals(canonical) && !value.isEmpty()) {
                    addPattern(value, MatchedField.IDENTIFIER, record);
                }
            }
        }

        private void addPattern(String text, MatchedField kind, WatchlistRecord record) {
            List<WatchlistRecord> list = byPattern.computeIfAbsent(text, k -> new ArrayList<>());
            if (list.isEmpty()) {
                patterns.add(new ExactPattern(text, kind));
            }
            if (!list.contains(record)) {
                list.add(record);
            }
        }

        private double idfOf(String feature) {
            return idf.getOrDefault(feature, unseenIdf);
        }
    }
}
