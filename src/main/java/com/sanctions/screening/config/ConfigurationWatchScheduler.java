package com.sanctions.screening.config;

import com.sanctions.screening.core.WatchlistReloadService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Hot reload: polls the watchlist file and the decision tuning file and reloads whichever changed.
 * Off unless {@code screening.hot-reload.enabled=true}. Classpath resources packed in a jar cannot be watched.
 */
@Slf4j
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "screening.hot-reload.enabled", havingValue = "true")
public class ConfigurationWatchScheduler {

    private final ConfigurationWatcher watcher;

    public ConfigurationWatchScheduler(ResourceLoader resourceLoader,
                                       WatchlistReloadService watchlistReloadService,
                                       DecisionTuningLoader decisionTuningLoader,
                                       @Value("${screening.watchlist.file:classpath:watchlist/sanctions-sample.json}")
                                       String watchlistFile) {
        this.watcher = new ConfigurationWatcher(Clock.systemUTC());
        Path watchlist = fileOf(resourceLoader.getResource(watchlistFile));
        if (watchlist != null && watchlistReloadService.isSupported()) {
            watcher.watch(watchlist, watchlistReloadService::reload);
        } else {
            log.info("Watchlist {} is not watchable, reload it through the admin API instead", watchlistFile);
        }
        decisionTuningLoader.getTuningFile().ifPresent(file -> watcher.watch(file, decisionTuningLoader::apply));
    }

    @Bean
    public ConfigurationWatcher configurationWatcher() {
        return watcher;
    }

    @Scheduled(fixedDelayString = "${screening.hot-reload.interval-ms:5000}",
            initialDelayString = "${screening.hot-reload.interval-ms:5000}")
    public void poll() {
        watcher.checkForChanges();
    }

    private static Path fileOf(Resource resource) {
        if (!resource.isFile()) {
            return null;
        }
        try {
            return resource.getFile().toPath();
        } catch (IOException e) {
            log.warn("Cannot resolve {} to a file: {}", resource.getDescription(), e.toString());
            return null;
        }
    }
}
