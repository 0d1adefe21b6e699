package com.sanctions.screening.core.tier;

import com.sanctions.screening.index.ExactPattern;
import lombok.Value;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;

/**
 * Multi-pattern matcher compiled once from all known names, aliases and identifiers.
 * Lookup is linear in the input length and independent of the number of patterns.
 * Immutable after {@link #build(Collection)}; safe to share between request threads.
 */
public final class AhoCorasickAutomaton {

    private final List<Map<Character, Integer>> transitions;
    private final int[] failure;
    private final List<int[]> outputs;
    private final List<ExactPattern> patterns;

    private AhoCorasickAutomaton(List<Map<Character, Integer>> transitions, int[] failure,
                                 List<int[]> outputs, List<ExactPattern> patterns) {
        this.transitions = transitions;
        this.failure = failure;
        this.outputs = outputs;
        this.patterns = patterns;
    }

    public static AhoCorasickAutomaton build(Collection<ExactPattern> source) {
        List<Map<Character, Integer>> go = new ArrayList<>();
        List<List<Integer>> out = new ArrayList<>();
        List<ExactPattern> patterns = new ArrayList<>();
        go.add(new HashMap<>());
        out.add(new ArrayList<>());

        for (ExactPattern pattern : source) {
            String text = pattern.getText();
            if (text == null || text.isEmpty()) continue;
            int state = 0;
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                Integer next = go.get(state).get(c);
                if (next == null) {
                    next = go.size();
                    go.add(new HashMap<>());
                    out.add(new ArrayList<>());
                    go.get(state).put(c, next);
                }
                state = next;
            }
            if (out.get(state).isEmpty()) {
                patterns.add(pattern);
                out.get(state).add(patterns.size() - 1);
            }
        }

        int[] fail = new int[go.size()];
        Queue<Integer> queue = new ArrayDeque<>();
        for (int child : go.get(0).values()) {
            fail[child] = 0;
            queue.add(child);
        }
        while (!queue.isEmpty()) {
            int state = queue.poll();
            for (Map.Entry<Character, Integer> edge : go.get(state).entrySet()) {
                char c = edge.getKey();
                int child = edge.getValue();
                int f = fail[state];
                while (f != 0 && !go.get(f).containsKey(c)) {
                    f = fail[f];
                }
                Integer target = go.get(f).get(c);
                fail[child] = target != null && target != child ? target : 0;
                out.get(child).addAll(out.get(fail[child]));
                queue.add(child);
            }
        }

        List<int[]> compactOut = new ArrayList<>(out.size());
        for (List<Integer> o : out) {
            compactOut.add(o.stream().mapToInt(Integer::intValue).toArray());
        }
        List<Map<Character, Integer>> frozen = new ArrayList<>(go.size());
        for (Map<Character, Integer> m : go) {
            frozen.add(Map.copyOf(m));
        }
        return new AhoCorasickAutomaton(List.copyOf(frozen), fail, List.copyOf(compactOut), List.copyOf(patterns));
    }

    /** Every pattern occurrence in {@code text}, in order of end position. */
    public List<Match> findAll(String text) {
        List<Match> matches = new ArrayList<>();
        int state = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            while (state != 0 && !transitions.get(state).containsKey(c)) {
                state = failure[state];
            }
            state = transitions.get(state).getOrDefault(c, 0);
            for (int p : outputs.get(state)) {
                ExactPattern pattern = patterns.get(p);
                matches.add(new Match(pattern, i + 1 - pattern.getText().length(), i + 1));
            }
        }
        return matches;
    }

    /**
     * The pattern that spans the whole of {@code text}, if any. Substring hits are ignored,
     * so a common word inside a longer name never counts as a match.
     */
    public Optional<ExactPattern> matchWhole(String text) {
        if (text == null || text.isEmpty()) return Optional.empty();
        for (Match m : findAll(text)) {
            if (m.getStart() == 0 && m.getEnd() == text.length()) {
                return Optional.of(m.getPattern());
            }
        }
        return Optional.empty();
    }

    public int patternCount() {
        return patterns.size();
    }

    public int stateCount() {
        return transitions.size();
    }

    @Value
    public static class Match {
        ExactPattern pattern;
        int start;
        int end;
    }
}
