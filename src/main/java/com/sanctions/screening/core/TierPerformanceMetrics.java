package com.sanctions.screening.core;

import com.sanctions.screening.domain.RiskLevel;
import com.sanctions.screening.domain.ScreeningTier;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Per-tier latency, failure and escalation counters plus request-level totals and the
 * risk-level distribution. Read by the metrics endpoint, never consulted on the decision path.
 * Shadow runs are only counted, so they do not skew production latencies.
 */
@Slf4j
@Component
public class TierPerformanceMetrics {

    /** Latest samples kept per tier for percentiles. */
    static final int LATENCY_WINDOW = 1024;

    private final Map<ScreeningTier, TierCounters> tiers = new EnumMap<>(ScreeningTier.class);
    private final Map<RiskLevel, LongAdder> riskLevels = new EnumMap<>(RiskLevel.class);
    private final LongAdder requests = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder earlyStops = new LongAdder();
    private final LongAdder escalations = new LongAdder();
    private final LongAdder cancellations = new LongAdder();
    private final LongAdder shadowRuns = new LongAdder();
    private final AtomicLong totalLatencyMs = new AtomicLong();

    public TierPerformanceMetrics() {
        for (ScreeningTier tier : ScreeningTier.values()) {
            tiers.put(tier, new TierCounters());
        }
        for (RiskLevel level : RiskLevel.values()) {
            riskLevels.put(level, new LongAdder());
        }
    }

    public void recordTier(ScreeningTier tier, long latencyMs, int candidates, boolean failed) {
        TierCounters c = tiers.get(tier);
        c.invocations.increment();
        c.latencyMs.addAndGet(latencyMs);
        c.candidates.add(candidates);
        c.window.add(latencyMs);
        if (failed) {
            c.failures.increment();
        }
        log.debug("Recorded tier={} latency={}ms candidates={} failed={}", tier, latencyMs, candidates, failed);
    }

    public void recordRequest(long latencyMs, RiskLevel riskLevel, boolean cacheHit, boolean earlyStopped,
                              boolean escalated) {
        requests.increment();
        totalLatencyMs.addAndGet(latencyMs);
        if (riskLevel != null) riskLevels.get(riskLevel).increment();
        if (cacheHit) cacheHits.increment();
        if (earlyStopped) earlyStops.increment();
        if (escalated) escalations.increment();
    }

    public void recordCancellation() {
        cancellations.increment();
    }

    public void recordShadowRun() {
        shadowRuns.increment();
    }

    /**
     * Zeroes every counter and latency window. Concurrent recordings may land on either side of the reset.
     */
    public void reset() {
        for (TierCounters c : tiers.values()) {
            c.reset();
        }
        for (LongAdder count : riskLevels.values()) {
            count.reset();
        }
        requests.reset();
        cacheHits.reset();
        earlyStops.reset();
        escalations.reset();
        cancellations.reset();
        shadowRuns.reset();
        totalLatencyMs.set(0);
        log.info("Screening metrics reset");
    }

    public TierStats getStats(ScreeningTier tier) {
        TierCounters c = tiers.get(tier);
        long n = c.invocations.sum();
        long[] sorted = c.window.sortedSnapshot();
        return new TierStats(
                tier,
                n,
                c.failures.sum(),
                n == 0 ? 0L : c.latencyMs.get() / n,
                percentile(sorted, 0.95, 20),
                percentile(sorted, 0.99, 100),
                n == 0 ? 0.0 : (double) c.candidates.sum() / n);
    }

    public List<TierStats> getAllStats() {
        List<TierStats> all = new ArrayList<>();
        for (ScreeningTier tier : ScreeningTier.values()) {
            all.add(getStats(tier));
        }
        return all;
    }

    public RequestStats getRequestStats() {
        long n = requests.sum();
        Map<RiskLevel, Long> distribution = new EnumMap<>(RiskLevel.class);
        riskLevels.forEach((level, count) -> distribution.put(level, count.sum()));
        return new RequestStats(n, cacheHits.sum(), earlyStops.sum(), escalations.sum(), cancellations.sum(),
                shadowRuns.sum(), n == 0 ? 0L : totalLatencyMs.get() / n, distribution);
    }

    /**
     * Nearest-rank percentile; falls back to the maximum until more than {@code minSamples} samples exist.
     */
    static long percentile(long[] sorted, double quantile, int minSamples) {
        if (sorted.length == 0) return 0L;
        if (sorted.length <= minSamples) return sorted[sorted.length - 1];
        int index = Math.min(sorted.length - 1, (int) (quantile * sorted.length));
        return sorted[index];
    }

    private static class TierCounters {
        private final LongAdder invocations = new LongAdder();
        private final LongAdder failures = new LongAdder();
        private final AtomicLong latencyMs = new AtomicLong();
        private final LongAdder candidates = new LongAdder();
        private final LatencyWindow window = new LatencyWindow(LATENCY_WINDOW);

        void reset() {
            invocations.reset();
            failures.reset();
            latencyMs.set(0);
            candidates.reset();
            window.clear();
        }
    }

    /**
     * Ring buffer of the latest latencies.
     */
    private static final class LatencyWindow {
        private final long[] samples;
        private int next;
        private int size;

        LatencyWindow(int capacity) {
            this.samples = new long[capacity];
        }

        synchronized void add(long value) {
            samples[next] = value;
            next = (next + 1) % samples.length;
            if (size < samples.length) size++;
        }

        synchronized void clear() {
            next = 0;
            size = 0;
        }

        long[] sortedSnapshot() {
            long[] copy;
            synchronized (this) {
                copy = Arrays.copyOf(samples, size);
            }
            Arrays.sort(copy);
            return copy;
        }
    }

    /**
     * Immutable snapshot for one tier.
     */
    @Value
    public static class TierStats {
        ScreeningTier tier;
        long invocations;
        long failures;
        long averageLatencyMs;
        long p95LatencyMs;
        long p99LatencyMs;
        double averageCandidates;
    }

    @Value
    public static class RequestStats {
        long requests;
        long cacheHits;
        long earlyStops;
        /** Requests where the vector tier was invoked. */
        long escalations;
        long cancellations;
        long shadowRuns;
        long averageLatencyMs;
        Map<RiskLevel, Long> riskLevelDistribution;
    }
}
