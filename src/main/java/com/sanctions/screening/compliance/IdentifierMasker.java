package com.sanctions.screening.compliance;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Redacts identity data so it is safe to include in logs and audit events.
 * Identifiers keep their type prefix and last two characters; names keep only initials.
 */
public final class IdentifierMasker {

    private static final int VISIBLE_SUFFIX = 2;

    private IdentifierMasker() {}

    /** {@code "INN:1234567890"} becomes {@code "INN:********90"}. */
    public static String maskIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) return null;
        int colon = identifier.indexOf(':');
        String prefix = colon >= 0 ? identifier.substring(0, colon + 1) : "";
        String value = colon >= 0 ? identifier.substring(colon + 1) : identifier;
        if (value.length() <= VISIBLE_SUFFIX) {
            return prefix + "*".repeat(value.length());
        }
        return prefix + "*".repeat(value.length() - VISIBLE_SUFFIX) + value.substring(value.length() - VISIBLE_SUFFIX);
    }

    public static List<String> maskIdentifiers(List<String> identifiers) {
        if (identifiers == null) return List.of();
        return identifiers.stream().map(IdentifierMasker::maskIdentifier).collect(Collectors.toList());
    }

    /** {@code ["ivan", "petrov"]} becomes {@code "i*** p*****"}. */
    public static String maskName(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) return null;
        return tokens.stream()
                .map(t -> t.isEmpty() ? t : t.charAt(0) + "*".repeat(t.length() - 1))
                .collect(Collectors.joining(" "));
    }
}
