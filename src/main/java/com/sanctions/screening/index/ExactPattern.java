package com.sanctions.screening.index;

import com.sanctions.screening.domain.MatchedField;
import lombok.Value;

/**
 * A string the exact-match automaton should recognise, already in canonical form.
 */
@Value
public class ExactPattern {
    String text;
    /** NAME for names and aliases, IDENTIFIER for regulatory IDs. */
    MatchedField kind;
}
