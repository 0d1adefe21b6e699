package com.sanctions.screening.core;

import com.sanctions.screening.domain.RiskLevel;
import com.sanctions.screening.domain.ScreeningTier;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TierPerformanceMetricsTest {

    private final TierPerformanceMetrics metrics = new TierPerformanceMetrics();

    @Test
    void tierStatsAverageLatencyAndCandidates() {
        metrics.recordTier(ScreeningTier.BLOCKING, 10, 4, false);
        metrics.recordTier(ScreeningTier.BLOCKING, 30, 2, true);

        TierPerformanceMetrics.TierStats stats = metrics.getStats(ScreeningTier.BLOCKING);

        assertThat(stats.getInvocations()).isEqualTo(2);
        assertThat(stats.getFailures()).isEqualTo(1);
        assertThat(stats.getAverageLatencyMs()).isEqualTo(20);
        assertThat(stats.getAverageCandidates()).isEqualTo(3.0);
    }

    @Test
    void untouchedTierReportsZeros() {
        TierPerformanceMetrics.TierStats stats = metrics.getStats(ScreeningTier.VECTOR);

        assertThat(stats.getInvocations()).isZero();
        assertThat(stats.getAverageLatencyMs()).isZero();
        assertThat(metrics.getAllStats()).hasSize(ScreeningTier.values().length);
    }

    @Test
    void requestStatsCountOutcomes() {
        metrics.recordRequest(10, RiskLevel.HIGH, false, true, false);
        metrics.recordRequest(2, RiskLevel.HIGH, true, false, false);
        metrics.recordRequest(30, RiskLevel.LOW, false, false, true);
        metrics.recordCancellation();

        TierPerformanceMetrics.RequestStats stats = metrics.getRequestStats();

        assertThat(stats.getRequests()).isEqualTo(3);
        assertThat(stats.getCacheHits()).isEqualTo(1);
        assertThat(stats.getEarlyStops()).isEqualTo(1);
        assertThat(stats.getEscalations()).isEqualTo(1);
        assertThat(stats.getCancellations()).isEqualTo(1);
        assertThat(stats.getAverageLatencyMs()).isEqualTo(14);
        assertThat(stats.getRiskLevelDistribution())
                .containsEntry(RiskLevel.HIGH, 2L)
                .containsEntry(RiskLevel.MEDIUM, 0L)
                .containsEntry(RiskLevel.LOW, 1L)
                .containsEntry(RiskLevel.SKIP, 0L);
    }

    @Test
    void percentilesFallBackToMaxUntilEnoughSamples() {
        for (long ms = 1; ms <= 10; ms++) {
            metrics.recordTier(ScreeningTier.EXACT, ms, 0, false);
        }

        TierPerformanceMetrics.TierStats stats = metrics.getStats(ScreeningTier.EXACT);

        assertThat(stats.getP95LatencyMs()).isEqualTo(10);
        assertThat(stats.getP99LatencyMs()).isEqualTo(10);
    }

    @Test
    void percentilesUseNearestRankOverLatestWindow() {
        for (long ms = 1; ms <= 200; ms++) {
            metrics.recordTier(ScreeningTier.VECTOR, ms, 0, false);
        }

        TierPerformanceMetrics.TierStats stats = metrics.getStats(ScreeningTier.VECTOR);

        assertThat(stats.getP95LatencyMs()).isEqualTo(191);
        assertThat(stats.getP99LatencyMs()).isEqualTo(199);
    }

    @Test
    void windowKeepsOnlyLatestSamples() {
        for (int i = 0; i < TierPerformanceMetrics.LATENCY_WINDOW; i++) {
            metrics.recordTier(ScreeningTier.BLOCKING, 1000, 0, false);
        }
        for (int i = 0; i < TierPerformanceMetrics.LATENCY_WINDOW; i++) {
            metrics.recordTier(ScreeningTier.BLOCKING, 5, 0, false);
        }

        assertThat(metrics.getStats(ScreeningTier.BLOCKING).getP99LatencyMs()).isEqualTo(5);
    }

    @Test
    void resetZeroesCountersAndWindows() {
        metrics.recordTier(ScreeningTier.RERANK, 7, 3, true);
        metrics.recordRequest(7, RiskLevel.MEDIUM, false, false, false);
        metrics.recordShadowRun();

        metrics.reset();

        assertThat(metrics.getStats(ScreeningTier.RERANK).getInvocations()).isZero();
        assertThat(metrics.getStats(ScreeningTier.RERANK).getP95LatencyMs()).isZero();
        TierPerformanceMetrics.RequestStats stats = metrics.getRequestStats();
        assertThat(stats.getRequests()).isZero();
        assertThat(stats.getShadowRuns()).isZero();
        assertThat(stats.getRiskLevelDistribution()).containsEntry(RiskLevel.MEDIUM, 0L);
    }
}
