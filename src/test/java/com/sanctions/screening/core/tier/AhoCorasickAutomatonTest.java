package com.sanctions.screening.core.tier;

import com.sanctions.screening.domain.MatchedField;
import com.sanctions.screening.index.ExactPattern;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AhoCorasickAutomatonTest {

    private final AhoCorasickAutomaton automaton = AhoCorasickAutomaton.build(List.of(
            new ExactPattern("he", MatchedField.NAME),
            new ExactPattern("she", MatchedField.NAME),
            new ExactPattern("his", MatchedField.NAME),
            new ExactPattern("hers", MatchedField.NAME)));

    @Test
    void findsOverlappingOccurrences() {
        List<AhoCorasickAutomaton.Match> matches = automaton.findAll("ushers");

        assertThat(matches).extracting(m -> m.getPattern().getText())
                .containsExactlyInAnyOrder("she", "he", "hers");
        assertThat(matches).filteredOn(m -> m.getPattern().getText().equals("hers"))
                .singleElement()
                .satisfies(m -> {
                    assertThat(m.getStart()).isEqualTo(2);
                    assertThat(m.getEnd()).isEqualTo(6);
                });
    }

    @Test
    void matchWholeIgnoresSubstringHits() {
        assertThat(automaton.matchWhole("hers")).map(ExactPattern::getText).contains("hers");
        assertThat(automaton.matchWhole("ushers")).isEmpty();
        assertThat(automaton.matchWhole("")).isEmpty();
    }

    @Test
    void duplicatePatternsAreStoredOnce() {
        AhoCorasickAutomaton a = AhoCorasickAutomaton.build(List.of(
                new ExactPattern("ivan petrov", MatchedField.NAME),
                new ExactPattern("ivan petrov", MatchedField.NAME),
                new ExactPattern("", MatchedField.NAME)));

        assertThat(a.patternCount()).isEqualTo(1);
        assertThat(a.findAll("ivan petrov")).hasSize(1);
    }

    @Test
    void handlesCyrillic() {
        AhoCorasickAutomaton a = AhoCorasickAutomaton.build(List.of(new ExactPattern("иван петров", MatchedField.NAME)));

        assertThat(a.matchWhole("иван петров")).isPresent();
        assertThat(a.matchWhole("иван петрович")).isEmpty();
    }
}
