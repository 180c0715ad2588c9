package com.pulse.trending.cluster;

import java.util.Locale;

/**
 * Edit-distance based similarity between keywords.
 *
 * <p>{@link #editSimilarity} is {@code 1 - levenshtein / maxLength}. {@link #similarity}
 * scales the remaining distance by the shared prefix (at most {@link #MAX_PREFIX}
 * characters) so that abbreviations such as "tech"/"technology" score as related.
 * A boost of 0 gives the plain edit similarity. Both are symmetric, 1 on identical
 * input and within [0,1] for boosts up to 0.25.
 */
public final class KeywordSimilarity {

    public static final int MAX_PREFIX = 4;

    private KeywordSimilarity() {}

    /**
     * Classic dynamic-programming edit distance, unit cost for substitution, insertion and
     * deletion. Uses two rolling rows.
     */
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
                curr[j] = Math.min(
                    Math.min(curr[j - 1] + 1, prev[j] + 1),
                    prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }

    public static double editSimilarity(String a, String b) {
        String k1 = a.toLowerCase(Locale.ROOT);
        String k2 = b.toLowerCase(Locale.ROOT);
        int maxLen = Math.max(k1.length(), k2.length());
        if (maxLen == 0) return 1.0;
        return 1.0 - (double) levenshtein(k1, k2) / maxLen;
    }

    public static double similarity(String a, String b, double prefixBoost) {
        double edit = editSimilarity(a, b);
        if (prefixBoost <= 0.0 || edit >= 1.0) return edit;
        int prefix = commonPrefix(a.toLowerCase(Locale.ROOT), b.toLowerCase(Locale.ROOT));
        return edit + prefix * prefixBoost * (1.0 - edit);
    }

    static int commonPrefix(String a, String b) {
        int limit = Math.min(MAX_PREFIX, Math.min(a.length(), b.length()));
        int n = 0;
        while (n < limit && a.charAt(n) == b.charAt(n)) {
            n++;
        }
        return n;
    }
}
