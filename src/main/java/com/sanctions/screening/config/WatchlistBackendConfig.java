package com.sanctions.screening.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sanctions.screening.index.InMemoryWatchlistBackend;
import com.sanctions.screening.index.WatchlistRecord;
import com.sanctions.screening.text.NgramVectorizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.List;

/**
 * Reference watchlist backend over a JSON corpus loaded at startup and reloadable at runtime. Any other
 * {@link com.sanctions.screening.index.WatchlistBackend} bean can replace it by setting
 * {@code screening.backend.type} to something else.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "screening.backend.type", havingValue = "in-memory", matchIfMissing = true)
public class WatchlistBackendConfig {

    private static final TypeReference<List<WatchlistRecord>> RECORDS = new TypeReference<>() {};

    @Value("${screening.watchlist.file:classpath:watchlist/sanctions-sample.json}")
    private String watchlistFile;

    @Bean
    public InMemoryWatchlistBackend inMemoryWatchlistBackend(ResourceLoader resourceLoader,
                                                             NgramVectorizer ngramVectorizer) {
        List<WatchlistRecord> records = load(resourceLoader.getResource(watchlistFile));
        InMemoryWatchlistBackend backend = new InMemoryWatchlistBackend(records, ngramVectorizer, watchlistFile,
                Clock.systemUTC());
        log.info("Watchlist loaded: file={}, records={}", watchlistFile, backend.size());
        return backend;
    }

    public static List<WatchlistRecord> load(Resource resource) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        try (InputStream in = resource.getInputStream()) {
            return mapper.readValue(in, RECORDS);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load watchlist from " + resource.getDescription(), e);
        }
    }
}
