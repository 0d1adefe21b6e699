package com.sanctions.screening.config;

import com.sanctions.screening.api.ScreeningInternalException;
import com.sanctions.screening.decision.DecisionEngine;
import com.sanctions.screening.decision.DecisionWeights;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecisionTuningLoaderTest {

    @TempDir
    Path dir;

    private final DecisionWeights base = DecisionWeights.defaults();
    private final DecisionEngine engine = new DecisionEngine(base);

    private DecisionTuningLoader loader(Path file) {
        return new DecisionTuningLoader(engine, base, file.toString());
    }

    @Test
    void startupAppliesOverridesOverBoundWeights() throws IOException {
        Path file = Files.writeString(dir.resolve("tuning.json"), "{\"threshold-high\": 0.8, \"person\": 0.35}");

        loader(file).init();

        assertThat(engine.getWeights().getThresholdHigh()).isEqualTo(0.8);
        assertThat(engine.getWeights().getPerson()).isEqualTo(0.35);
        assertThat(engine.getWeights().getThresholdMedium()).isEqualTo(0.65);
    }

    @Test
    void removedKeyFallsBackToBoundValue() throws IOException {
        Path file = Files.writeString(dir.resolve("tuning.json"), "{\"threshold-high\": 0.8}");
        DecisionTuningLoader loader = loader(file);
        loader.apply();

        Files.writeString(file, "{}");
        loader.apply();

        assertThat(engine.getWeights()).isEqualTo(base);
    }

    @Test
    void invalidOverridesLeaveCurrentWeightsInPlace() throws IOException {
        Path file = Files.writeString(dir.resolve("tuning.json"), "{\"threshold-medium\": 0.9}");

        assertThatThrownBy(() -> loader(file).apply())
                .isInstanceOf(ScreeningInternalException.class)
                .hasMessageContaining("threshold-medium");
        assertThat(engine.getWeights()).isEqualTo(base);
    }

    @Test
    void unknownKeyIsRejected() throws IOException {
        Path file = Files.writeString(dir.resolve("tuning.json"), "{\"thresold-high\": 0.8}");

        assertThatThrownBy(() -> loader(file).apply())
                .isInstanceOf(ScreeningInternalException.class)
                .hasMessageContaining("thresold-high");
    }

    @Test
    void unparsableFileIsReported() throws IOException {
        Path file = Files.writeString(dir.resolve("tuning.json"), "{not json");

        assertThatThrownBy(() -> loader(file).apply()).isInstanceOf(UncheckedIOException.class);
        assertThat(engine.getWeights()).isEqualTo(base);
    }

    @Test
    void missingFileIsSkippedAtStartup() {
        loader(dir.resolve("absent.json")).init();

        assertThat(engine.getWeights()).isEqualTo(base);
    }

    @Test
    void blankSettingMeansNoTuningFile() {
        DecisionTuningLoader none = new DecisionTuningLoader(engine, base, "");

        assertThat(none.getTuningFile()).isEmpty();
        assertThatThrownBy(none::apply).isInstanceOf(IllegalStateException.class);
    }
}
