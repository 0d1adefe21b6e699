package com.sanctions.screening.compliance;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierMaskerTest {

    @Test
    void keepsTypePrefixAndLastTwoCharacters() {
        assertThat(IdentifierMasker.maskIdentifier("INN:1234567890")).isEqualTo("INN:********90");
        assertThat(IdentifierMasker.maskIdentifier("7211004455")).isEqualTo("********55");
    }

    @Test
    void shortValuesAreFullyMasked() {
        assertThat(IdentifierMasker.maskIdentifier("ID:12")).isEqualTo("ID:**");
        assertThat(IdentifierMasker.maskIdentifier("7")).isEqualTo("*");
    }

    @Test
    void blankIdentifierMasksToNull() {
        assertThat(IdentifierMasker.maskIdentifier(null)).isNull();
        assertThat(IdentifierMasker.maskIdentifier("  ")).isNull();
        assertThat(IdentifierMasker.maskIdentifiers(null)).isEmpty();
        assertThat(IdentifierMasker.maskIdentifiers(Arrays.asList("INN:1234567890", null)))
                .containsExactly("INN:********90", null);
    }

    @Test
    void namesKeepOnlyInitials() {
        assertThat(IdentifierMasker.maskName(List.of("ivan", "petrov"))).isEqualTo("i*** p*****");
        assertThat(IdentifierMasker.maskName(List.of())).isNull();
        assertThat(IdentifierMasker.maskName(null)).isNull();
    }
}
