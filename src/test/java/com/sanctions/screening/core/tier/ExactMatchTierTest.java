package com.sanctions.screening.core.tier;

import com.sanctions.screening.domain.Candidate;
import com.sanctions.screening.domain.MatchedField;
import com.sanctions.screening.domain.NormalizedEntity;
import com.sanctions.screening.domain.ScreeningTier;
import com.sanctions.screening.index.InMemoryWatchlistBackend;
import com.sanctions.screening.index.WatchlistBackend;
import com.sanctions.screening.index.WatchlistFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExactMatchTierTest {

    private final InMemoryWatchlistBackend watchlist = WatchlistFixtures.backend();
    private ExecutorService pool;
    private ExactMatchTier tier;

    @BeforeEach
    void setUp() {
        pool = TierTestSupport.newPool();
        tier = new ExactMatchTier(watchlist, watchlist, TierTestSupport.callExecutor(pool), TierSettings.defaults());
        tier.init();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static NormalizedEntity entity(List<String> tokens, List<String> identifiers) {
        return NormalizedEntity.builder().tokens(tokens).identifiers(identifiers).build();
    }

    @Test
    void fullNameMatchIsExactCandidate() {
        TierResult result = tier.run(TierTestSupport.request(entity(List.of("Ivan", "Petrov"), null)));

        assertThat(result.getTier()).isEqualTo(ScreeningTier.EXACT);
        assertThat(result.isEscalate()).isFalse();
        assertThat(result.getCandidates()).singleElement().satisfies(c -> {
            assertThat(c.getId()).isEqualTo("SDN-1001");
            assertThat(c.getRawScore()).isEqualTo(1.0);
            assertThat(c.getSourceTier()).isZero();
            assertThat(c.getMatchedFields()).containsExactly(MatchedField.NAME);
        });
    }

    @Test
    void surnameFirstAndCyrillicAliasMatch() {
        assertThat(tier.run(TierTestSupport.request(entity(List.of("petrov", "ivan"), null))).getCandidates())
                .extracting(Candidate::getId).containsExactly("SDN-1001");
        assertThat(tier.run(TierTestSupport.request(entity(List.of("Иван", "Петров"), null))).getCandidates())
                .extracting(Candidate::getId).containsExactly("SDN-1001");
    }

    @Test
    void identifierMatchesWithOrWithoutTypePrefix() {
        TierResult typed = tier.run(TierTestSupport.request(entity(List.of("john", "doe"), List.of("inn: 1234567890"))));
        TierResult bare = tier.run(TierTestSupport.request(entity(List.of("john", "doe"), List.of("1234567890"))));

        assertThat(typed.getCandidates()).singleElement().satisfies(c -> {
            assertThat(c.getId()).isEqualTo("SDN-1001");
            assertThat(c.getMatchedFields()).containsExactly(MatchedField.IDENTIFIER);
        });
        assertThat(bare.getCandidates()).extracting(Candidate::getId).containsExactly("SDN-1001");
    }

    @Test
    void typedIdentifierDoesNotMatchRecordIdentifierOfAnotherType() {
        TierResult result = tier.run(TierTestSupport.request(
                entity(List.of("john", "doe"), List.of("PASSPORT:1234567890"))));

        assertThat(result.getCandidates()).isEmpty();
        assertThat(result.isEscalate()).isTrue();
    }

    @Test
    void nameAndIdentifierOnSameRecordAreMerged() {
        TierResult result = tier.run(TierTestSupport.request(
                entity(List.of("ivan", "petrov"), List.of("INN:1234567890"))));

        assertThat(result.getCandidates()).singleElement()
                .satisfies(c -> assertThat(c.getMatchedFields())
                        .containsExactlyInAnyOrder(MatchedField.NAME, MatchedField.IDENTIFIER));
    }

    @Test
    void partialNameIsNotAMatch() {
        TierResult result = tier.run(TierTestSupport.request(entity(List.of("ivan", "petrov", "junior"), null)));

        assertThat(result.getCandidates()).isEmpty();
        assertThat(result.isEscalate()).isTrue();
        assertThat(result.hasError()).isFalse();
    }

    @Test
    void identifierTextInNameIsNotANameMatch() {
        TierResult result = tier.run(TierTestSupport.request(entity(List.of("1234567890"), null)));

        assertThat(result.getCandidates()).isEmpty();
    }

    @Test
    void backendFailureDegradesWithoutThrowing() {
        WatchlistBackend broken = mock(WatchlistBackend.class);
        when(broken.exactLookup(any())).thenThrow(new IllegalStateException("index down"));
        ExactMatchTier degraded = new ExactMatchTier(watchlist, broken, TierTestSupport.callExecutor(pool),
                TierSettings.defaults());
        degraded.init();

        TierResult result = degraded.run(TierTestSupport.request(entity(List.of("ivan", "petrov"), null)));

        assertThat(result.hasError()).isTrue();
        assertThat(result.getCandidates()).isEmpty();
        assertThat(result.isEscalate()).isTrue();
    }

    @Test
    void noPatternMeansNoBackendCall() {
        WatchlistBackend backend = mock(WatchlistBackend.class);
        ExactMatchTier t = new ExactMatchTier(watchlist, backend, TierTestSupport.callExecutor(pool),
                TierSettings.defaults());
        t.init();

        t.run(TierTestSupport.request(entity(List.of("olga", "unknown"), null)));

        verify(backend, never()).exactLookup(any());
    }
}
