package com.sanctions.screening.text;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Soundex-style code that works for Latin and Cyrillic spellings of the same name.
 * Cyrillic is transliterated first, so "Петров" and "Petrov" both encode to {@code P361}.
 */
public final class PhoneticEncoder {

    static final int MAX_LENGTH = 6;

    private static final Map<Character, String> CYRILLIC = new HashMap<>();

    static {
        String[][] table = {
                {"а", "a"}, {"б", "b"}, {"в", "v"}, {"г", "g"}, {"ґ", "g"}, {"д", "d"},
                {"е", "e"}, {"ё", "e"}, {"є", "e"}, {"ж", "zh"}, {"з", "z"}, {"и", "i"},
                {"і", "i"}, {"ї", "i"}, {"й", "i"}, {"к", "k"}, {"л", "l"}, {"м", "m"},
                {"н", "n"}, {"о", "o"}, {"п", "p"}, {"р", "r"}, {"с", "s"}, {"т", "t"},
                {"у", "u"}, {"ф", "f"}, {"х", "h"}, {"ц", "c"}, {"ч", "ch"}, {"ш", "sh"},
                {"щ", "sh"}, {"ы", "y"}, {"э", "e"}, {"ю", "u"}, {"я", "ya"}, {"ь", ""}, {"ъ", ""}
        };
        for (String[] pair : table) {
            CYRILLIC.put(pair[0].charAt(0), pair[1]);
        }
    }

    private PhoneticEncoder() {}

    public static String encode(String token) {
        return encode(token, true);
    }

    /**
     * @param transliterate false to skip the Cyrillic table (ASCII fast path)
     * @return the code, or an empty string when the token has no letters
     */
    public static String encode(String token, boolean transliterate) {
        if (token == null || token.isBlank()) return "";
        String s = token.toLowerCase(Locale.ROOT);
        if (transliterate) {
            s = transliterate(s);
        }
        s = s.replaceAll("(ch)+", "ch").replaceAll("(sh)+", "sh");

        int start = 0;
        while (start < s.length() && !Character.isLetter(s.charAt(start))) {
            start++;
        }
        if (start == s.length()) return "";

        char first = s.charAt(start);
        StringBuilder code = new StringBuilder(MAX_LENGTH);
        code.append(Character.toUpperCase(first));
        char last = digitFor(first);
        for (int i = start + 1; i < s.length() && code.length() < MAX_LENGTH; i++) {
            char c = s.charAt(i);
            if (!Character.isLetter(c) || c == 'h') {
                continue;
            }
            char d = digitFor(c);
            if (d == '0') {
                // vowels separate runs of the same consonant group
                last = '0';
                continue;
            }
            if (d != last) {
                code.append(d);
            }
            last = d;
        }
        return code.toString();
    }

    /** Replaces Cyrillic letters with their Latin groups; other characters pass through. */
    public static String transliterate(String lowerCased) {
        StringBuilder out = new StringBuilder(lowerCased.length() + 4);
        for (int i = 0; i < lowerCased.length(); i++) {
            char c = lowerCased.charAt(i);
            String mapped = CYRILLIC.get(c);
            if (mapped != null) {
                out.append(mapped);
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static char digitFor(char c) {
        switch (c) {
            case 'a': case 'e': case 'i': case 'o': case 'u': case 'y':
                return '0';
            case 'b': case 'f': case 'p': case 'v': case 'w':
                return '1';
            case 'c': case 'g': case 'j': case 'k': case 'q': case 's': case 'x': case 'z':
                return '2';
            case 'd': case 't':
                return '3';
            case 'l':
                return '4';
            case 'm': case 'n':
                return '5';
            case 'r':
                return '6';
            default:
                return '0';
        }
    }
}
