package com.sanctions.screening.config;

import com.sanctions.screening.domain.EntityType;
import com.sanctions.screening.index.WatchlistRecord;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WatchlistBackendConfigTest {

    @Test
    void bundledSampleWatchlistLoads() {
        List<WatchlistRecord> records = WatchlistBackendConfig.load(new ClassPathResource("watchlist/sanctions-sample.json"));

        assertThat(records).hasSize(10);
        WatchlistRecord petrov = records.stream().filter(r -> r.getId().equals("SDN-1001")).findFirst().orElseThrow();
        assertThat(petrov.getDateOfBirth()).isEqualTo(LocalDate.of(1971, 3, 14));
        assertThat(petrov.getIdentifiers()).contains("INN:1234567890");
        assertThat(records).filteredOn(r -> r.getEntityType() == EntityType.ORGANIZATION).hasSize(4);
    }

    @Test
    void unknownPropertiesAreIgnored() {
        String json = "[{\"id\":\"X-1\",\"name\":\"Test Person\",\"entityType\":\"PERSON\",\"source\":\"manual\"}]";

        List<WatchlistRecord> records = WatchlistBackendConfig.load(
                new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8)));

        assertThat(records).singleElement().extracting(WatchlistRecord::getName).isEqualTo("Test Person");
    }

    @Test
    void unreadableFileFailsStartup() {
        assertThatThrownBy(() -> WatchlistBackendConfig.load(new ClassPathResource("watchlist/missing.json")))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("missing.json");
    }
}
