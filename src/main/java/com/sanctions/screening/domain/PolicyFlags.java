package com.sanctions.screening.domain;

import lombok.EqualsAndHashCode;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable set of {@link PolicyFlag}s travelling with one request.
 * Never shared as global state; derive a new instance with {@link #with(PolicyFlag...)}.
 */
@EqualsAndHashCode
public final class PolicyFlags {

    private static final PolicyFlags NONE = new PolicyFlags(EnumSet.noneOf(PolicyFlag.class));

    private final Set<PolicyFlag> flags;

    private PolicyFlags(EnumSet<PolicyFlag> flags) {
        this.flags = Collections.unmodifiableSet(flags);
    }

    public static PolicyFlags none() {
        return NONE;
    }

    public static PolicyFlags of(PolicyFlag... flags) {
        return of(Arrays.asList(flags));
    }

    public static PolicyFlags of(Collection<PolicyFlag> flags) {
        if (flags == null || flags.isEmpty()) {
            return NONE;
        }
        return new PolicyFlags(EnumSet.copyOf(flags));
    }

    public boolean has(PolicyFlag flag) {
        return flags.contains(flag);
    }

    public PolicyFlags with(PolicyFlag... extra) {
        EnumSet<PolicyFlag> copy = flags.isEmpty() ? EnumSet.noneOf(PolicyFlag.class) : EnumSet.copyOf(flags);
        copy.addAll(Arrays.asList(extra));
        return new PolicyFlags(copy);
    }

    public PolicyFlags without(PolicyFlag flag) {
        if (!flags.contains(flag)) {
            return this;
        }
        EnumSet<PolicyFlag> copy = EnumSet.copyOf(flags);
        copy.remove(flag);
        return new PolicyFlags(copy);
    }

    /** True when the result cache must be neither read nor written. */
    public boolean bypassesCache() {
        return has(PolicyFlag.NO_CACHE) || has(PolicyFlag.DEBUG_TRACE);
    }

    public Set<PolicyFlag> asSet() {
        return flags;
    }

    /** Sorted, comma-separated flag names; part of the cache key. */
    public String canonical() {
        return flags.stream().map(Enum::name).sorted().collect(Collectors.joining(","));
    }

    @Override
    public String toString() {
        return "[" + canonical() + "]";
    }
}
