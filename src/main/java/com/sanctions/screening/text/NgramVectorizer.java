package com.sanctions.screening.text;

import lombok.Getter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns name tokens into a blended character n-gram and word n-gram vector.
 * Each block is L2-normalised and scaled by its weight before the blocks are summed,
 * so one long block cannot drown the other.
 */
@Getter
public class NgramVectorizer {

    static final String CHAR_PREFIX = "c:";
    static final String WORD_PREFIX = "w:";

    private final int charMin;
    private final int charMax;
    private final int wordMin;
    private final int wordMax;
    private final double charWeight;
    private final double wordWeight;

    public NgramVectorizer(int charMin, int charMax, int wordMin, int wordMax, double charWeight, double wordWeight) {
        if (charMin < 1 || charMax < charMin || wordMin < 1 || wordMax < wordMin) {
            throw new IllegalArgumentException("Invalid n-gram ranges: char=" + charMin + ".." + charMax
                    + " word=" + wordMin + ".." + wordMax);
        }
        this.charMin = charMin;
        this.charMax = charMax;
        this.wordMin = wordMin;
        this.wordMax = wordMax;
        this.charWeight = charWeight;
        this.wordWeight = wordWeight;
    }

    /** char 3-5 at 0.4, word 1-2 at 0.3. */
    public static NgramVectorizer defaults() {
        return new NgramVectorizer(3, 5, 1, 2, 0.4, 0.3);
    }

    public SparseVector vectorize(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) return SparseVector.empty();
        Map<String, Double> chars = charNgrams(tokens);
        Map<String, Double> words = wordNgrams(tokens);

        Map<String, Double> combined = new HashMap<>();
        addBlock(combined, chars, charWeight);
        addBlock(combined, words, wordWeight);
        return SparseVector.of(combined).normalized();
    }

    private Map<String, Double> charNgrams(List<String> tokens) {
        String text = " " + TextCanonicalizer.canonicalName(tokens) + " ";
        Map<String, Double> counts = new HashMap<>();
        for (int n = charMin; n <= charMax; n++) {
            for (int i = 0; i + n <= text.length(); i++) {
                counts.merge(CHAR_PREFIX + text.substring(i, i + n), 1.0, Double::sum);
            }
        }
        return counts;
    }

    private Map<String, Double> wordNgrams(List<String> tokens) {
        List<String> words = tokens.stream()
                .map(TextCanonicalizer::canonicalToken)
                .filter(t -> !t.isEmpty())
                .toList();
        Map<String, Double> counts = new HashMap<>();
        for (int n = wordMin; n <= wordMax; n++) {
            for (int i = 0; i + n <= words.size(); i++) {
                counts.merge(WORD_PREFIX + String.join(" ", words.subList(i, i + n)), 1.0, Double::sum);
            }
        }
        return counts;
    }

    private static void addBlock(Map<String, Double> target, Map<String, Double> block, double weight) {
        if (block.isEmpty() || weight <= 0.0) return;
        double norm = Math.sqrt(block.values().stream().mapToDouble(v -> v * v).sum());
        block.forEach((k, v) -> target.merge(k, weight * v / norm, Double::sum));
    }
}
