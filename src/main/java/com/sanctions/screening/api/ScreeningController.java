package com.sanctions.screening.api;

import com.sanctions.screening.compliance.ScreeningAuditLogger;
import com.sanctions.screening.core.ScreeningCache;
import com.sanctions.screening.core.ScreeningCacheKeyFactory;
import com.sanctions.screening.core.ScreeningOrchestrator;
import com.sanctions.screening.core.TierPerformanceMetrics;
import com.sanctions.screening.domain.NormalizedEntity;
import com.sanctions.screening.domain.ScreeningResult;
import com.sanctions.screening.messaging.ScreeningEventProducer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API for screening entities against the watchlist.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/screening")
@RequiredArgsConstructor
@Tag(name = "Screening", description = "Screen names and identifiers against sanctions watchlists")
public class ScreeningController {

    private final ScreeningOrchestrator orchestrator;
    private final ScreeningCache cache;
    private final ScreeningCacheKeyFactory keyFactory;
    private final TierPerformanceMetrics metrics;
    private final ScreeningAuditLogger auditLogger;
    private final ScreeningEventProducer eventProducer;

    @PostMapping
    @Operation(
            summary = "Screen entity",
            description = "Runs the tiered screening pipeline (exact, blocking, vector on escalation, rerank) and "
                    + "returns the risk decision with its reasons and candidates. Backend failures degrade the result "
                    + "and are listed in decisionReasons as backend_unavailable:<tier>; they never fail the request.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Screening decided. Check body.riskLevel and body.reviewRequired.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ScreeningResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed or malformed entity. Body: { \"error\": \"VALIDATION_FAILED\"|\"MALFORMED_INPUT\", ... }"),
            @ApiResponse(responseCode = "500", description = "Decision could not be produced. Body: { \"error\": \"INTERNAL_ERROR\", \"message\": \"...\" }")
    })
    public ResponseEntity<ScreeningResponseDto> screen(@Valid @RequestBody ScreeningRequestDto dto) {
        NormalizedEntity entity = dto.toEntity();
        auditLogger.logRequest(entity);

        ScreeningResult result = orchestrator.screen(entity);

        auditLogger.logDecision(result);
        eventProducer.publishDecision(keyFactory.keyFor(entity), entity, result);
        return ResponseEntity.ok(ScreeningResponseDto.from(result));
    }

    @GetMapping("/metrics")
    @Operation(summary = "Pipeline metrics", description = "Cache hit rate, size and evictions, per-tier latency percentiles and failure counts, and the risk-level distribution.")
    public ResponseEntity<Map<String, Object>> metrics() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("cache", cache.metrics());
        body.put("requests", metrics.getRequestStats());
        body.put("tiers", metrics.getAllStats());
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/metrics")
    @Operation(summary = "Reset metrics", description = "Zeroes request, tier and risk-level counters and latency windows.")
    @ApiResponse(responseCode = "204", description = "Metrics reset")
    public ResponseEntity<Void> resetMetrics() {
        metrics.reset();
        log.info("Screening metrics reset via API");
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/cache")
    @Operation(summary = "Invalidate cache", description = "Drops every cached screening result, e.g. after a watchlist update.")
    @ApiResponse(responseCode = "204", description = "Cache cleared")
    public ResponseEntity<Void> invalidateCache() {
        cache.invalidateAll();
        log.info("Screening cache invalidated via API");
        return ResponseEntity.noContent().build();
    }
}
