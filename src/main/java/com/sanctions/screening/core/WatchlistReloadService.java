package com.sanctions.screening.core;

import com.sanctions.screening.config.WatchlistBackendConfig;
import com.sanctions.screening.core.tier.ExactMatchTier;
import com.sanctions.screening.index.ReloadableWatchlist;
import com.sanctions.screening.index.WatchlistRecord;
import com.sanctions.screening.index.WatchlistStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Re-reads the configured watchlist file into the backend, recompiles the exact-match automaton and drops
 * cached results that were computed against the previous list.
 */
@Slf4j
@Service
public class WatchlistReloadService {

    private final ObjectProvider<ReloadableWatchlist> watchlist;
    private final ResourceLoader resourceLoader;
    private final ExactMatchTier exactMatchTier;
    private final ScreeningCache cache;
    private final String watchlistFile;

    public WatchlistReloadService(ObjectProvider<ReloadableWatchlist> watchlist,
                                  ResourceLoader resourceLoader,
                                  ExactMatchTier exactMatchTier,
                                  ScreeningCache cache,
                                  @Value("${screening.watchlist.file:classpath:watchlist/sanctions-sample.json}")
                                  String watchlistFile) {
        this.watchlist = watchlist;
        this.resourceLoader = resourceLoader;
        this.exactMatchTier = exactMatchTier;
        this.cache = cache;
        this.watchlistFile = watchlistFile;
    }

    public boolean isSupported() {
        return watchlist.getIfAvailable() != null;
    }

    /**
     * @throws WatchlistReloadException if the backend cannot reload, or the file is unreadable or empty
     */
    public synchronized WatchlistReloadResult reload() {
        ReloadableWatchlist target = requireReloadable();
        List<WatchlistRecord> records;
        try {
            records = WatchlistBackendConfig.load(resourceLoader.getResource(watchlistFile));
        } catch (UncheckedIOException e) {
            throw new WatchlistReloadException("Watchlist reload failed: " + e.getMessage(), e);
        }
        if (records == null || records.isEmpty()) {
            throw new WatchlistReloadException("Refusing to replace the watchlist with an empty file: " + watchlistFile);
        }

        WatchlistStatus status = target.replace(records, watchlistFile);
        exactMatchTier.init();
        boolean cacheInvalidated = true;
        try {
            cache.invalidateAll();
        } catch (ScreeningCacheException e) {
            cacheInvalidated = false;
            log.warn("Watchlist reloaded but cached results could not be dropped; they expire with their TTL: {}",
                    e.getMessage());
        }
        log.info("Watchlist reloaded: source={}, generation={}, records={}, cacheInvalidated={}",
                status.getSource(), status.getGeneration(), status.getRecords(), cacheInvalidated);
        return new WatchlistReloadResult(status, cacheInvalidated);
    }

    public WatchlistStatus status() {
        return requireReloadable().status();
    }

    private ReloadableWatchlist requireReloadable() {
        ReloadableWatchlist target = watchlist.getIfAvailable();
        if (target == null) {
            throw new WatchlistReloadException("The configured watchlist backend does not support reload");
        }
        return target;
    }
}
