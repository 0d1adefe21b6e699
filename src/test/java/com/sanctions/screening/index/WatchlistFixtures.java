package com.sanctions.screening.index;

import com.sanctions.screening.domain.EntityType;
import com.sanctions.screening.text.NgramVectorizer;

import java.time.LocalDate;
import java.util.List;

/**
 * Small watchlist shared by index and tier tests.
 */
public final class WatchlistFixtures {

    private WatchlistFixtures() {}

    public static WatchlistRecord petrov() {
        return WatchlistRecord.builder()
                .id("SDN-1001")
                .name("Ivan Petrov")
                .aliases(List.of("Иван Петров", "Ivan Petrow"))
                .entityType(EntityType.PERSON)
                .dateOfBirth(LocalDate.of(1971, 3, 14))
                .identifiers(List.of("INN:1234567890"))
                .program("UKRAINE-EO13662")
                .country("RU")
                .build();
    }

    public static WatchlistRecord petrovsky() {
        return WatchlistRecord.builder()
                .id("SDN-1004")
                .name("Dmitry Petrovsky")
                .entityType(EntityType.PERSON)
                .dateOfBirth(LocalDate.of(1975, 1, 30))
                .identifiers(List.of("PASSPORT:7211004455"))
                .program("BELARUS-EO14038")
                .country("BY")
                .build();
    }

    public static WatchlistRecord pavelPetrov() {
        return WatchlistRecord.builder()
                .id("SDN-1007")
                .name("Pavel Petrov")
                .entityType(EntityType.PERSON)
                .dateOfBirth(LocalDate.of(1990, 6, 1))
                .program("RUSSIA-EO14024")
                .country("RU")
                .build();
    }

    public static WatchlistRecord smirnova() {
        return WatchlistRecord.builder()
                .id("SDN-1003")
                .name("Olga Smirnova")
                .entityType(EntityType.PERSON)
                .dateOfBirth(LocalDate.of(1980, 7, 21))
                .program("RUSSIA-EO14024")
                .country("RU")
                .build();
    }

    public static WatchlistRecord rosneft() {
        return WatchlistRecord.builder()
                .id("SDN-2001")
                .name("Rosneft Trading")
                .aliases(List.of("Rosneft Trading SA"))
                .entityType(EntityType.ORGANIZATION)
                .identifiers(List.of("OGRN:1027700043502"))
                .program("UKRAINE-EO13662")
                .country("RU")
                .build();
    }

    public static List<WatchlistRecord> all() {
        return List.of(petrov(), petrovsky(), pavelPetrov(), smirnova(), rosneft());
    }

    public static InMemoryWatchlistBackend backend() {
        return new InMemoryWatchlistBackend(all(), NgramVectorizer.defaults());
    }
}
