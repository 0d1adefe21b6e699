package com.sanctions.screening.core;

import com.sanctions.screening.domain.Candidate;
import com.sanctions.screening.domain.NormalizedEntity;
import com.sanctions.screening.domain.PolicyFlag;
import com.sanctions.screening.domain.ScreeningResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

/**
 * Best-effort background re-run of a request through the full escalation path, for comparing
 * pipeline variants in production. Never awaited, never cached; failures are only logged.
 */
@Slf4j
@Component
public class ShadowScreeningRunner {

    private final Executor executor;
    private final boolean enabled;

    public ShadowScreeningRunner(@Qualifier("shadowExecutor") Executor executor,
                                 @Value("${screening.shadow.enabled:true}") boolean enabled) {
        this.executor = executor;
        this.enabled = enabled;
    }

    /**
     * @return true if the shadow run was scheduled
     */
    public boolean submit(NormalizedEntity entity, ScreeningResult primary,
                          Function<NormalizedEntity, ScreeningResult> pipeline) {
        if (!enabled) {
            return false;
        }
        NormalizedEntity shadowEntity = shadowVariant(entity);
        try {
            executor.execute(() -> run(shadowEntity, primary, pipeline));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("[SHADOW] dropped requestId={}: executor saturated", primary.getRequestId());
            return false;
        }
    }

    static NormalizedEntity shadowVariant(NormalizedEntity entity) {
        return entity.toBuilder()
                .policyFlags(entity.flags()
                        .without(PolicyFlag.SHADOW_MODE)
                        .with(PolicyFlag.FORCE_VECTOR, PolicyFlag.NO_CACHE))
                .build();
    }

    ShadowComparison run(NormalizedEntity shadowEntity, ScreeningResult primary,
                         Function<NormalizedEntity, ScreeningResult> pipeline) {
        try {
            ScreeningResult shadow = pipeline.apply(shadowEntity);
            ShadowComparison comparison = new ShadowComparison(
                    primary.getRequestId(),
                    primary.getDecision().getRiskLevel(),
                    shadow.getDecision().getRiskLevel(),
                    primary.getDecision().getRiskScore(),
                    shadow.getDecision().getRiskScore(),
                    topId(primary.getCandidates()),
                    topId(shadow.getCandidates()));
            log.info("[SHADOW] requestId={} diverged={} primaryLevel={} shadowLevel={} primaryScore={} shadowScore={} "
                            + "primaryTop={} shadowTop={} shadowTiers={}",
                    comparison.getRequestId(), comparison.isDiverged(),
                    comparison.getPrimaryLevel(), comparison.getShadowLevel(),
                    String.format(java.util.Locale.ROOT, "%.3f", comparison.getPrimaryScore()),
                    String.format(java.util.Locale.ROOT, "%.3f", comparison.getShadowScore()),
                    comparison.getPrimaryTopId(), comparison.getShadowTopId(), shadow.getTiersExecuted());
            return comparison;
        } catch (Exception e) {
            log.warn("[SHADOW] run failed requestId={}: {}", primary.getRequestId(), e.toString());
            return null;
        }
    }

    private static String topId(List<Candidate> candidates) {
        return candidates == null || candidates.isEmpty() ? null : candidates.get(0).getId();
    }
}
