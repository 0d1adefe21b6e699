package com.sanctions.screening.text;

/**
 * Edit-distance based similarity used by the reranker.
 */
public final class StringSimilarity {

    private StringSimilarity() {}

    public static int levenshtein(String a, String b) {
        if (a.equals(b)) return 0;
        if (a.isEmpty()) return b.length();
        if (b.isEmpty()) return a.length();
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }

    /** 1 - distance / longer length, in [0,1]. Two empty strings are identical. */
    public static double similarity(String a, String b) {
        int max = Math.max(a.length(), b.length());
        if (max == 0) return 1.0;
        return 1.0 - (double) levenshtein(a, b) / max;
    }

    /** Best of the plain and token-sorted comparison, so word order does not matter. */
    public static double nameSimilarity(String canonicalA, String canonicalB) {
        double direct = similarity(canonicalA, canonicalB);
        if (direct == 1.0) return direct;
        double sorted = similarity(TextCanonicalizer.tokenSorted(canonicalA), TextCanonicalizer.tokenSorted(canonicalB));
        return Math.max(direct, sorted);
    }
}
