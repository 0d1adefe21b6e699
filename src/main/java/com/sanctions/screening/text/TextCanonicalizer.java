package com.sanctions.screening.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Canonical string forms shared by the exact-match automaton and the watchlist index,
 * so both sides of a comparison are built the same way.
 */
public final class TextCanonicalizer {

    private static final Set<String> STOPWORDS = Set.of(
            "mr", "mrs", "ms", "dr", "llc", "ltd", "inc", "ooo", "tov", "jsc", "pjsc", "ооо", "тов", "пао", "ао");

    private static final Map<String, String> ID_TYPE_ALIASES = Map.of("INN", "TIN");

    private TextCanonicalizer() {}

    /** Lower-cased, trimmed, whitespace-collapsed name; tokens joined with one space. */
    public static String canonicalName(List<String> tokens) {
        return tokens.stream()
                .map(TextCanonicalizer::canonicalToken)
                .filter(t -> !t.isEmpty())
                .collect(Collectors.joining(" "));
    }

    public static String canonicalName(String name) {
        if (name == null) return "";
        return canonicalName(List.of(name.trim().split("\\s+")));
    }

    public static String canonicalToken(String token) {
        if (token == null) return "";
        return token.trim().toLowerCase(Locale.ROOT).replace('ё', 'е');
    }

    /** Name with its tokens sorted, so "petrov ivan" and "ivan petrov" compare equal. */
    public static String tokenSorted(String canonicalName) {
        if (canonicalName.isEmpty()) return canonicalName;
        String[] parts = canonicalName.split(" ");
        java.util.Arrays.sort(parts);
        return String.join(" ", parts);
    }

    /**
     * Upper-cased identifier without whitespace and dashes. "inn: 123-456" becomes "INN:123456".
     */
    public static String canonicalIdentifier(String identifier) {
        if (identifier == null) return "";
        return identifier.toUpperCase(Locale.ROOT).replaceAll("[\\s-]", "");
    }

    /** Value part of a TYPE:VALUE identifier, or the whole identifier when there is no type. */
    public static String identifierValue(String canonicalIdentifier) {
        int idx = canonicalIdentifier.indexOf(':');
        return idx >= 0 ? canonicalIdentifier.substring(idx + 1) : canonicalIdentifier;
    }

    /** Type part of a TYPE:VALUE identifier with INN folded into TIN, or null when there is no type. */
    public static String identifierType(String canonicalIdentifier) {
        int idx = canonicalIdentifier.indexOf(':');
        if (idx <= 0) return null;
        String type = canonicalIdentifier.substring(0, idx);
        return ID_TYPE_ALIASES.getOrDefault(type, type);
    }

    /**
     * Two canonical identifiers denote the same document when their values are equal and,
     * if both carry a type, the types agree. PASSPORT:X never matches INN:X.
     */
    public static boolean sameIdentifier(String canonicalA, String canonicalB) {
        if (!identifierValue(canonicalA).equals(identifierValue(canonicalB))) return false;
        String typeA = identifierType(canonicalA);
        String typeB = identifierType(canonicalB);
        return typeA == null || typeB == null || typeA.equals(typeB);
    }

    /** Drops honorifics, legal-form words and single letters. Never returns an empty list for non-empty input. */
    public static List<String> withoutStopwords(List<String> tokens) {
        List<String> kept = new ArrayList<>();
        for (String token : tokens) {
            String t = canonicalToken(token).replace(".", "");
            if (t.length() > 1 && !STOPWORDS.contains(t)) {
                kept.add(token);
            }
        }
        return kept.isEmpty() ? tokens : kept;
    }

    /** First letter after transliteration, so Latin and Cyrillic initials compare equal; null if there is none. */
    public static String initial(String token) {
        String t = PhoneticEncoder.transliterate(canonicalToken(token));
        for (int i = 0; i < t.length(); i++) {
            if (Character.isLetter(t.charAt(i))) {
                return String.valueOf(t.charAt(i));
            }
        }
        return null;
    }

    public static boolean isAscii(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) > 127) return false;
        }
        return true;
    }
}
