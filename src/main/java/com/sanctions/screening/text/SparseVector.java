package com.sanctions.screening.text;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Immutable term-weight vector keyed by n-gram feature name.
 */
public final class SparseVector {

    private static final SparseVector EMPTY = new SparseVector(Map.of());

    private final Map<String, Double> weights;
    private final double norm;

    private SparseVector(Map<String, Double> weights) {
        this.weights = Collections.unmodifiableMap(weights);
        double sum = 0.0;
        for (double w : weights.values()) {
            sum += w * w;
        }
        this.norm = Math.sqrt(sum);
    }

    public static SparseVector empty() {
        return EMPTY;
    }

    public static SparseVector of(Map<String, Double> weights) {
        if (weights == null || weights.isEmpty()) return EMPTY;
        return new SparseVector(new HashMap<>(weights));
    }

    public Map<String, Double> weights() {
        return weights;
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }

    public int size() {
        return weights.size();
    }

    public double norm() {
        return norm;
    }

    public double dot(SparseVector other) {
        Map<String, Double> small = weights.size() <= other.weights.size() ? weights : other.weights;
        Map<String, Double> large = small == weights ? other.weights : weights;
        double sum = 0.0;
        for (Map.Entry<String, Double> e : small.entrySet()) {
            Double w = large.get(e.getKey());
            if (w != null) {
                sum += e.getValue() * w;
            }
        }
        return sum;
    }

    /** Cosine similarity clamped to [0,1]; 0 when either side is empty. */
    public double cosine(SparseVector other) {
        if (norm == 0.0 || other.norm == 0.0) return 0.0;
        double c = dot(other) / (norm * other.norm);
        return Math.max(0.0, Math.min(1.0, c));
    }

    public SparseVector normalized() {
        if (norm == 0.0 || Math.abs(norm - 1.0) < 1e-12) return this;
        Map<String, Double> out = new HashMap<>(weights.size());
        weights.forEach((k, v) -> out.put(k, v / norm));
        return new SparseVector(out);
    }

    /** Multiplies each weight by {@code factor(feature)}; features mapped to 0 are dropped. */
    public SparseVector reweighted(ToDoubleFunction<String> factor) {
        Map<String, Double> out = new HashMap<>(weights.size());
        weights.forEach((k, v) -> {
            double w = v * factor.applyAsDouble(k);
            if (w != 0.0) {
                out.put(k, w);
            }
        });
        return out.isEmpty() ? EMPTY : new SparseVector(out);
    }

    @Override
    public String toString() {
        return "SparseVector{size=" + weights.size() + ", norm=" + norm + "}";
    }
}
