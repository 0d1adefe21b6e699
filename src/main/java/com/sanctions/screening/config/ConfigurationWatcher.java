package com.sanctions.screening.config;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Polls file modification times and runs the callbacks registered for a file when it changes.
 * A failing callback is logged and counted; whatever it was reloading keeps its previous state.
 * A file that disappears is ignored until it shows up again.
 */
@Slf4j
public class ConfigurationWatcher {

    private final Clock clock;
    private final Map<Path, WatchedFile> watched = new LinkedHashMap<>();
    private long reloadCount;
    private long failureCount;
    private Instant lastReload;
    private String lastError;

    public ConfigurationWatcher(Clock clock) {
        this.clock = clock;
    }

    public synchronized void watch(Path path, Runnable onChange) {
        Path key = path.toAbsolutePath().normalize();
        watched.computeIfAbsent(key, p -> new WatchedFile(lastModified(p))).callbacks.add(onChange);
        log.info("Watching {} for changes", key);
    }

    /**
     * @return the files whose modification time moved since the previous check
     */
    public synchronized List<Path> checkForChanges() {
        List<Path> changed = new ArrayList<>();
        for (Map.Entry<Path, WatchedFile> entry : watched.entrySet()) {
            WatchedFile file = entry.getValue();
            FileTime current = lastModified(entry.getKey());
            if (current == null || current.equals(file.lastModified)) {
                continue;
            }
            file.lastModified = current;
            changed.add(entry.getKey());
            trigger(entry.getKey(), file.callbacks);
        }
        return changed;
    }

    public synchronized ReloadStats stats() {
        List<String> files = new ArrayList<>();
        watched.keySet().forEach(p -> files.add(p.toString()));
        return new ReloadStats(files, reloadCount, failureCount, lastReload, lastError);
    }

    private void trigger(Path path, List<Runnable> callbacks) {
        log.info("Configuration file changed: {}", path);
        for (Runnable callback : callbacks) {
            try {
                callback.run();
                reloadCount++;
                lastReload = clock.instant();
            } catch (RuntimeException e) {
                failureCount++;
                lastError = path + ": " + e.getMessage();
                log.error("Reload after change to {} failed, previous state stays active", path, e);
            }
        }
    }

    private static FileTime lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            log.debug("Cannot stat {}: {}", path, e.toString());
            return null;
        }
    }

    private static final class WatchedFile {
        private final List<Runnable> callbacks = new ArrayList<>();
        private FileTime lastModified;

        WatchedFile(FileTime lastModified) {
            this.lastModified = lastModified;
        }
    }

    @Value
    public static class ReloadStats {
        List<String> watchedFiles;
        long reloadCount;
        long failureCount;
        Instant lastReload;
        String lastError;
    }
}
