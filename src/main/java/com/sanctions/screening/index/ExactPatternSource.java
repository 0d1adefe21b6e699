package com.sanctions.screening.index;

import java.util.Collection;

/**
 * Supplies every known name, alias and identifier so the exact matcher can compile its automaton once at startup.
 */
public interface ExactPatternSource {

    Collection<ExactPattern> exactPatterns();
}
