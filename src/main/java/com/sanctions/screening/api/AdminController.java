package com.sanctions.screening.api;

import com.sanctions.screening.config.ConfigurationWatcher;
import com.sanctions.screening.config.DecisionTuningLoader;
import com.sanctions.screening.core.WatchlistReloadResult;
import com.sanctions.screening.core.WatchlistReloadService;
import com.sanctions.screening.decision.DecisionEngine;
import com.sanctions.screening.index.WatchlistStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operational endpoints: watchlist reload and status, decision tuning reload and hot-reload state.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/screening/admin")
@RequiredArgsConstructor
@Tag(name = "Screening admin", description = "Reload the watchlist and tuning without a restart")
public class AdminController {

    private final WatchlistReloadService watchlistReloadService;
    private final DecisionTuningLoader decisionTuningLoader;
    private final DecisionEngine decisionEngine;
    private final ObjectProvider<ConfigurationWatcher> configurationWatcher;

    @PostMapping("/watchlist/reload")
    @Operation(summary = "Reload watchlist",
            description = "Re-reads the configured watchlist file, swaps the index and drops cached results. "
                    + "On failure the previous watchlist keeps serving.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "New watchlist is live"),
            @ApiResponse(responseCode = "409", description = "Reload refused. Body: { \"error\": \"RELOAD_REJECTED\", \"message\": \"...\" }")
    })
    public ResponseEntity<WatchlistReloadResult> reloadWatchlist() {
        WatchlistReloadResult result = watchlistReloadService.reload();
        log.info("Watchlist reloaded via API: generation={}", result.getWatchlist().getGeneration());
        return ResponseEntity.ok(result);
    }

    @GetMapping("/watchlist/status")
    @Operation(summary = "Watchlist status", description = "Source, size and load time of the watchlist being served.")
    public ResponseEntity<WatchlistStatus> watchlistStatus() {
        return ResponseEntity.ok(watchlistReloadService.status());
    }

    @PostMapping("/tuning/reload")
    @Operation(summary = "Reload decision tuning", description = "Re-applies the decision weight overrides file.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Weights now in effect"),
            @ApiResponse(responseCode = "409", description = "No tuning file configured")
    })
    public ResponseEntity<Object> reloadTuning() {
        if (decisionTuningLoader.getTuningFile().isEmpty()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "NO_TUNING_FILE", "message", "screening.tuning.file is not set"));
        }
        return ResponseEntity.ok(decisionTuningLoader.apply());
    }

    @GetMapping("/config")
    @Operation(summary = "Effective configuration", description = "Decision weights in effect and hot-reload state.")
    public ResponseEntity<Map<String, Object>> config() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("decisionWeights", decisionEngine.getWeights());
        ConfigurationWatcher watcher = configurationWatcher.getIfAvailable();
        body.put("hotReload", watcher != null ? watcher.stats() : Map.of("enabled", false));
        return ResponseEntity.ok(body);
    }
}
