package com.sanctions.screening.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sanctions.screening.decision.DecisionEngine;
import com.sanctions.screening.decision.DecisionWeights;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Applies decision weight overrides from an optional JSON file ({@code screening.tuning.file}) on top of the
 * weights bound from application properties, e.g. {@code {"threshold-high": 0.8}}. Keys missing from the file
 * fall back to the bound values, so removing a key reverts it.
 */
@Slf4j
@Component
public class DecisionTuningLoader {

    private static final TypeReference<Map<String, Double>> OVERRIDES = new TypeReference<>() {};

    private final DecisionEngine engine;
    private final DecisionWeights baseWeights;
    private final Path tuningFile;

    public DecisionTuningLoader(DecisionEngine engine, DecisionWeights baseWeights,
                                @Value("${screening.tuning.file:}") String tuningFile) {
        this.engine = engine;
        this.baseWeights = baseWeights;
        this.tuningFile = tuningFile == null || tuningFile.isBlank() ? null : Path.of(tuningFile);
    }

    @PostConstruct
    public void init() {
        if (tuningFile != null && Files.exists(tuningFile)) {
            apply();
        }
    }

    public Optional<Path> getTuningFile() {
        return Optional.ofNullable(tuningFile);
    }

    /**
     * Re-reads the tuning file and swaps the engine's weights.
     *
     * @throws UncheckedIOException if the file cannot be read or parsed
     * @throws com.sanctions.screening.api.ScreeningInternalException if the resulting weights are invalid
     */
    public DecisionWeights apply() {
        if (tuningFile == null) {
            throw new IllegalStateException("No tuning file configured (screening.tuning.file)");
        }
        Map<String, Double> overrides = read(tuningFile);
        DecisionWeights next = baseWeights.withOverrides(overrides);
        engine.updateWeights(next);
        log.info("Decision tuning applied from {}: overrides={}", tuningFile, overrides.keySet());
        return next;
    }

    static Map<String, Double> read(Path file) {
        ObjectMapper mapper = new ObjectMapper();
        try (InputStream in = Files.newInputStream(file)) {
            Map<String, Double> overrides = mapper.readValue(in, OVERRIDES);
            return overrides == null ? Map.of() : overrides;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read decision tuning from " + file, e);
        }
    }
}
