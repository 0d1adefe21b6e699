package com.sanctions.screening.core;

import com.sanctions.screening.api.ScreeningCancelledException;
import com.sanctions.screening.api.ScreeningInternalException;
import com.sanctions.screening.core.tier.Tier;
import com.sanctions.screening.core.tier.TierRequest;
import com.sanctions.screening.core.tier.TierResult;
import com.sanctions.screening.core.tier.TierSettings;
import com.sanctions.screening.decision.DecisionEngine;
import com.sanctions.screening.decision.DecisionEvidence;
import com.sanctions.screening.decision.ReasonCodes;
import com.sanctions.screening.domain.Candidate;
import com.sanctions.screening.domain.Decision;
import com.sanctions.screening.domain.MatchedField;
import com.sanctions.screening.domain.NormalizedEntity;
import com.sanctions.screening.domain.PolicyFlag;
import com.sanctions.screening.domain.PolicyFlags;
import com.sanctions.screening.domain.ScoreBreakdown;
import com.sanctions.screening.domain.ScreeningResult;
import com.sanctions.screening.domain.ScreeningTier;
import com.sanctions.screening.domain.TierDiagnostic;
import com.sanctions.screening.domain.UpstreamSignals;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs one screening end to end: cache, exact match, blocking, optional vector escalation,
 * rerank and decision. Tier failures degrade the result; only a decision failure aborts it.
 */
@Slf4j
@Service
public class ScreeningOrchestrator {

    static final String MDC_REQUEST_ID = "requestId";

    static final String SKIP_EARLY_STOP = "early_stop";
    static final String SKIP_DISABLED = "disabled";
    static final String SKIP_NOT_ESCALATED = "not_escalated";
    static final String SKIP_NO_CANDIDATES = "no_candidates";
    static final String SKIP_SMARTFILTER = "smartfilter_skip";

    private final List<Tier> tierBeans;
    private final ScreeningCache cache;
    private final ScreeningCacheKeyFactory keyFactory;
    private final DecisionEngine decisionEngine;
    private final TierSettings settings;
    private final TierPerformanceMetrics metrics;
    private final ShadowScreeningRunner shadowRunner;
    private final ExecutorService screeningExecutor;
    private final Duration cacheTtl;

    private Map<ScreeningTier, Tier> tiers;

    public ScreeningOrchestrator(List<Tier> tierBeans,
                                 ScreeningCache cache,
                                 ScreeningCacheKeyFactory keyFactory,
                                 DecisionEngine decisionEngine,
                                 TierSettings settings,
                                 TierPerformanceMetrics metrics,
                                 ShadowScreeningRunner shadowRunner,
                                 @Qualifier("screeningExecutorService") ExecutorService screeningExecutor,
                                 @Value("${screening.cache.ttl:10m}") Duration cacheTtl) {
        this.tierBeans = tierBeans;
        this.cache = cache;
        this.keyFactory = keyFactory;
        this.decisionEngine = decisionEngine;
        this.settings = settings;
        this.metrics = metrics;
        this.shadowRunner = shadowRunner;
        this.screeningExecutor = screeningExecutor;
        this.cacheTtl = cacheTtl;
    }

    @jakarta.annotation.PostConstruct
    void init() {
        Map<ScreeningTier, Tier> byTier = new EnumMap<>(ScreeningTier.class);
        for (Tier tier : tierBeans) {
            if (byTier.putIfAbsent(tier.tier(), tier) != null) {
                throw new IllegalStateException("Duplicate tier implementation for " + tier.tier());
            }
        }
        for (ScreeningTier required : ScreeningTier.values()) {
            if (!byTier.containsKey(required)) {
                throw new IllegalStateException("No tier implementation registered for " + required);
            }
        }
        tiers = byTier;
        log.info("ScreeningOrchestrator initialized: tiers={}, requestBudget={}ms, cacheTtl={}",
                tiers.keySet(), settings.getRequestBudget().toMillis(), cacheTtl);
    }

    /**
     * Screens one entity on the calling thread.
     *
     * @throws com.sanctions.screening.api.MalformedInputException if the entity fails validation
     * @throws ScreeningInternalException if the decision could not be produced
     */
    public ScreeningResult screen(NormalizedEntity entity) {
        EntityValidator.validate(entity);
        return runRequest(entity, new CancellationScope(), newRequestId());
    }

    /**
     * Screens one entity on the screening executor. Cancelling the returned future aborts every
     * backend call the request has started; nothing it produced is cached.
     */
    public CompletableFuture<ScreeningResult> screenAsync(NormalizedEntity entity) {
        EntityValidator.validate(entity);
        CancellationScope scope = new CancellationScope();
        String requestId = newRequestId();
        CompletableFuture<ScreeningResult> promise = new CompletableFuture<>();
        Future<?> task;
        try {
            task = screeningExecutor.submit(() -> {
                try {
                    promise.complete(runRequest(entity, scope, requestId));
                } catch (Throwable t) {
                    promise.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Screening executor rejected requestId={}", requestId);
            promise.completeExceptionally(new ScreeningInternalException("Screening executor saturated", e));
            return promise;
        }
        promise.whenComplete((result, error) -> {
            if (promise.isCancelled()) {
                scope.cancel();
                task.cancel(true);
                log.info("Screening cancelled by caller: requestId={}", requestId);
            }
        });
        return promise;
    }

    private ScreeningResult runRequest(NormalizedEntity entity, CancellationScope scope, String requestId) {
        String previous = MDC.get(MDC_REQUEST_ID);
        MDC.put(MDC_REQUEST_ID, requestId);
        try {
            return execute(entity, scope, requestId, false);
        } catch (ScreeningCancelledException e) {
            metrics.recordCancellation();
            throw e;
        } finally {
            if (previous == null) {
                MDC.remove(MDC_REQUEST_ID);
            } else {
                MDC.put(MDC_REQUEST_ID, previous);
            }
        }
    }

    /**
     * @param shadow true for a background comparison run; it is counted but kept out of the production metrics
     */
    private ScreeningResult execute(NormalizedEntity entity, CancellationScope scope, String requestId,
                                    boolean shadow) {
        RequestBudget budget = RequestBudget.start(settings.getRequestBudget());
        PolicyFlags flags = entity.flags();
        RequestTrace trace = new RequestTrace(shadow);

        String cacheKey = keyFactory.keyFor(entity);
        boolean useCache = !flags.bypassesCache();
        if (useCache) {
            Optional<ScreeningResult> cached = lookup(cacheKey, trace);
            if (cached.isPresent()) {
                ScreeningResult hit = cached.get();
                if (!shadow) {
                    metrics.recordRequest(budget.elapsedMs(), hit.getDecision().getRiskLevel(), true,
                            hit.isEarlyStopped(),
                            hit.getTiersExecuted() != null && hit.getTiersExecuted().contains(ScreeningTier.VECTOR));
                }
                log.info("Screening cache hit: requestId={}, cachedRequestId={}, riskLevel={}",
                        requestId, hit.getRequestId(), hit.getDecision().getRiskLevel());
                return hit;
            }
        }

        UpstreamSignals signals = entity.signalsOrDefault();
        List<Candidate> ranked;
        boolean earlyStopped = false;
        boolean escalated = false;

        if (!signals.isShouldProcess()) {
            for (ScreeningTier tier : ScreeningTier.values()) {
                trace.skipped(tier, SKIP_SMARTFILTER);
            }
            ranked = List.of();
        } else {
            TierResult exact = runTier(ScreeningTier.EXACT, entity, List.of(), budget, scope, trace);
            earlyStopped = exact.getCandidates().stream()
                    .anyMatch(c -> c.getRawScore() >= settings.getExactThreshold());

            List<List<Candidate>> sources = new ArrayList<>();
            sources.add(exact.getCandidates());

            if (earlyStopped) {
                trace.skipped(ScreeningTier.BLOCKING, SKIP_EARLY_STOP);
                trace.skipped(ScreeningTier.VECTOR, SKIP_EARLY_STOP);
            } else {
                boolean blockingSkipped = !settings.isBlockingEnabled() || flags.has(PolicyFlag.DISABLE_BLOCKING);
                TierResult blocking = null;
                if (blockingSkipped) {
                    trace.skipped(ScreeningTier.BLOCKING, SKIP_DISABLED);
                } else {
                    blocking = runTier(ScreeningTier.BLOCKING, entity, List.of(), budget, scope, trace);
                    sources.add(blocking.getCandidates());
                }

                if (!settings.isVectorEnabled() || flags.has(PolicyFlag.DISABLE_VECTOR)) {
                    trace.skipped(ScreeningTier.VECTOR, SKIP_DISABLED);
                } else if (shouldEscalate(flags, blocking)) {
                    escalated = true;
                    TierResult vector = runTier(ScreeningTier.VECTOR, entity, List.of(), budget, scope, trace);
                    sources.add(vector.getCandidates());
                } else {
                    trace.skipped(ScreeningTier.VECTOR, SKIP_NOT_ESCALATED);
                }
            }

            List<Candidate> merged = CandidateMerger.merge(sources, settings.getMaxCandidates());
            ranked = rerank(entity, merged, budget, scope, trace);
        }

        Decision decision = decide(entity, ranked, trace);
        scope.throwIfCancelled();

        ScreeningResult result = ScreeningResult.builder()
                .requestId(requestId)
                .candidates(List.copyOf(ranked))
                .decision(decision)
                .tierDiagnostics(List.copyOf(trace.diagnostics))
                .tiersExecuted(List.copyOf(trace.executed))
                .earlyStopped(earlyStopped)
                .cacheHit(false)
                .elapsedMs(budget.elapsedMs())
                .screenedAt(Instant.now())
                .build();

        if (useCache) {
            store(cacheKey, result);
        }
        if (shadow) {
            metrics.recordShadowRun();
        } else {
            metrics.recordRequest(result.getElapsedMs(), decision.getRiskLevel(), false, earlyStopped, escalated);
        }

        log.info("Screening completed: requestId={}, tiers={}, earlyStopped={}, candidates={}, riskLevel={}, "
                        + "riskScore={}, reviewRequired={}, elapsedMs={}",
                requestId, result.getTiersExecuted(), earlyStopped, ranked.size(), decision.getRiskLevel(),
                decision.getRiskScore(), decision.isReviewRequired(), result.getElapsedMs());

        if (flags.has(PolicyFlag.SHADOW_MODE)) {
            shadowRunner.submit(entity, result,
                    shadowEntity -> execute(shadowEntity, new CancellationScope(), requestId + "-shadow", true));
        }
        return result;
    }

    /**
     * Vector search runs when forced, when blocking did not run, or when blocking asked for it
     * and its best confidence is not already above the good-enough threshold.
     */
    private boolean shouldEscalate(PolicyFlags flags, TierResult blocking) {
        if (flags.has(PolicyFlag.FORCE_VECTOR) || blocking == null) {
            return true;
        }
        return blocking.isEscalate() && !(blocking.bestRawScore() > settings.getGoodEnoughThreshold());
    }

    private List<Candidate> rerank(NormalizedEntity entity, List<Candidate> merged, RequestBudget budget,
                                   CancellationScope scope, RequestTrace trace) {
        if (merged.isEmpty()) {
            trace.skipped(ScreeningTier.RERANK, SKIP_NO_CANDIDATES);
            return List.of();
        }
        TierResult reranked = runTier(ScreeningTier.RERANK, entity, merged, budget, scope, trace);
        if (reranked.hasError()) {
            // fall back to retrieval scores so the decision still sees the candidates
            List<Candidate> fallback = new ArrayList<>(merged.size());
            for (Candidate candidate : merged) {
                fallback.add(candidate.toBuilder().confidence(candidate.getRawScore()).build());
            }
            return fallback;
        }
        return reranked.getCandidates();
    }

    private TierResult runTier(ScreeningTier tierId, NormalizedEntity entity, List<Candidate> candidates,
                               RequestBudget budget, CancellationScope scope, RequestTrace trace) {
        scope.throwIfCancelled();
        TierRequest request = TierRequest.builder()
                .entity(entity)
                .candidates(candidates)
                .budget(budget)
                .scope(scope)
                .build();
        long start = System.nanoTime();
        TierResult result;
        try {
            result = tiers.get(tierId).run(request);
        } catch (ScreeningCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            long elapsed = (System.nanoTime() - start) / 1_000_000;
            log.warn("Tier {} failed unexpectedly, continuing degraded: {}", tierId, e.toString());
            result = TierResult.failed(tierId, elapsed, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        scope.throwIfCancelled();

        trace.executed(result);
        if (!trace.shadow) {
            metrics.recordTier(tierId, result.getElapsedMs(), result.getCandidates().size(), result.hasError());
        }
        if (result.hasError()) {
            log.warn("Tier {} degraded: partial={}, candidates={}, cause={}", tierId,
                    result.getError().isPartial(), result.getCandidates().size(), result.getError().getMessage());
            trace.degradations.add(ReasonCodes.backendUnavailable(tierId));
        } else {
            log.debug("Tier {} finished: candidates={}, escalate={}, elapsedMs={}", tierId,
                    result.getCandidates().size(), result.isEscalate(), result.getElapsedMs());
        }
        return result;
    }

    private Decision decide(NormalizedEntity entity, List<Candidate> ranked, RequestTrace trace) {
        UpstreamSignals signals = entity.signalsOrDefault();
        Candidate top = ranked.isEmpty() ? null : ranked.get(0);
        Candidate decisive = ranked.stream()
                .filter(c -> c.hasMatchedField(MatchedField.IDENTIFIER))
                .findFirst()
                .orElse(top);

        ScoreBreakdown breakdown = ScoreBreakdown.builder()
                .smartfilterSignal(signals.getSmartFilterConfidence())
                .personEvidence(signals.getPersonConfidence())
                .orgEvidence(signals.getOrgConfidence())
                .similarityTop(top == null ? 0.0 : top.getConfidence())
                .exactNameMatch(top != null && top.getSourceTier() == ScreeningTier.EXACT.getLevel()
                        && top.hasMatchedField(MatchedField.NAME))
                .idExactMatch(ranked.stream().anyMatch(c -> c.hasMatchedField(MatchedField.IDENTIFIER)))
                .dobMatch(decisive != null && decisive.hasMatchedField(MatchedField.DOB))
                .build();

        DecisionEvidence evidence = DecisionEvidence.builder()
                .breakdown(breakdown)
                .shouldProcess(signals.isShouldProcess())
                .inputHasIdentifiers(entity.hasIdentifiers())
                .inputHasDateOfBirth(entity.hasDateOfBirth())
                .decisiveTier(decisive == null ? null : ScreeningTier.fromLevel(decisive.getSourceTier()))
                .degradations(trace.degradations)
                .build();
        try {
            return decisionEngine.decide(evidence);
        } catch (ScreeningInternalException e) {
            log.error("Decision engine rejected evidence: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Decision engine failed", e);
            throw new ScreeningInternalException("Decision engine failed: " + e.getMessage(), e);
        }
    }

    private Optional<ScreeningResult> lookup(String key, RequestTrace trace) {
        try {
            return cache.get(key);
        } catch (RuntimeException e) {
            log.warn("Screening cache unavailable on get, treating as miss: {}", e.toString());
            trace.degradations.add(ReasonCodes.CACHE_UNAVAILABLE);
            return Optional.empty();
        }
    }

    private void store(String key, ScreeningResult result) {
        try {
            cache.put(key, result, cacheTtl);
        } catch (RuntimeException e) {
            log.warn("Screening cache unavailable on put, result not cached: requestId={}, cause={}",
                    result.getRequestId(), e.toString());
        }
    }

    private static String newRequestId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Mutable per-request bookkeeping; confined to the request's thread.
     */
    private static final class RequestTrace {
        private final boolean shadow;
        private final List<TierDiagnostic> diagnostics = new ArrayList<>();
        private final List<ScreeningTier> executed = new ArrayList<>();
        private final List<String> degradations = new ArrayList<>();

        RequestTrace(boolean shadow) {
            this.shadow = shadow;
        }

        void executed(TierResult result) {
            executed.add(result.getTier());
            diagnostics.add(TierDiagnostic.builder()
                    .tier(result.getTier())
                    .executed(true)
                    .elapsedMs(result.getElapsedMs())
                    .candidateCount(result.getCandidates().size())
                    .escalate(result.isEscalate())
                    .errorType(result.hasError() ? result.getError().getType().name() : null)
                    .errorMessage(result.hasError() ? result.getError().getMessage() : null)
                    .build());
        }

        void skipped(ScreeningTier tier, String reason) {
            diagnostics.add(TierDiagnostic.builder()
                    .tier(tier)
                    .executed(false)
                    .skipReason(reason)
                    .build());
        }
    }
}
