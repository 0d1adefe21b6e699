package com.sanctions.screening.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigurationWatcherTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path dir;

    private final ConfigurationWatcher watcher = new ConfigurationWatcher(Clock.fixed(NOW, ZoneOffset.UTC));

    private static void touch(Path file, long epochSecond) throws IOException {
        Files.setLastModifiedTime(file, FileTime.fromMillis(epochSecond * 1000));
    }

    @Test
    void unchangedFileTriggersNothing() throws IOException {
        Path file = Files.writeString(dir.resolve("tuning.json"), "{}");
        AtomicInteger calls = new AtomicInteger();
        watcher.watch(file, calls::incrementAndGet);

        assertThat(watcher.checkForChanges()).isEmpty();
        assertThat(calls).hasValue(0);
    }

    @Test
    void modifiedFileRunsCallbacksOnce() throws IOException {
        Path file = Files.writeString(dir.resolve("tuning.json"), "{}");
        touch(file, 1_000);
        AtomicInteger calls = new AtomicInteger();
        watcher.watch(file, calls::incrementAndGet);

        touch(file, 2_000);

        assertThat(watcher.checkForChanges()).containsExactly(file.toAbsolutePath().normalize());
        assertThat(watcher.checkForChanges()).isEmpty();
        assertThat(calls).hasValue(1);
        assertThat(watcher.stats().getReloadCount()).isEqualTo(1);
        assertThat(watcher.stats().getLastReload()).isEqualTo(NOW);
    }

    @Test
    void fileCreatedAfterRegistrationIsPickedUp() throws IOException {
        Path file = dir.resolve("later.json");
        AtomicInteger calls = new AtomicInteger();
        watcher.watch(file, calls::incrementAndGet);
        assertThat(watcher.checkForChanges()).isEmpty();

        Files.writeString(file, "{}");

        assertThat(watcher.checkForChanges()).hasSize(1);
        assertThat(calls).hasValue(1);
    }

    @Test
    void failingCallbackIsCountedAndOthersStillRun() throws IOException {
        Path file = Files.writeString(dir.resolve("watchlist.json"), "[]");
        touch(file, 1_000);
        AtomicInteger calls = new AtomicInteger();
        watcher.watch(file, () -> {
            throw new IllegalStateException("bad file");
        });
        watcher.watch(file, calls::incrementAndGet);

        touch(file, 2_000);
        watcher.checkForChanges();

        ConfigurationWatcher.ReloadStats stats = watcher.stats();
        assertThat(calls).hasValue(1);
        assertThat(stats.getFailureCount()).isEqualTo(1);
        assertThat(stats.getReloadCount()).isEqualTo(1);
        assertThat(stats.getLastError()).endsWith("bad file");
        assertThat(stats.getWatchedFiles()).containsExactly(file.toAbsolutePath().normalize().toString());
    }

    @Test
    void deletedFileKeepsPreviousState() throws IOException {
        Path file = Files.writeString(dir.resolve("tuning.json"), "{}");
        AtomicInteger calls = new AtomicInteger();
        watcher.watch(file, calls::incrementAndGet);

        Files.delete(file);

        assertThat(watcher.checkForChanges()).isEmpty();
        assertThat(calls).hasValue(0);
    }
}
