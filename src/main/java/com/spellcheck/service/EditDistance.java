package com.spellcheck.service;

import org.apache.commons.text.similarity.LevenshteinDistance;

/**
 * Edit distance primitives used for ranking.
 */
public final class EditDistance {

    private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

    private EditDistance() {}

    /**
     * Unit-cost insert/delete/substitute distance.
     */
    public static int levenshtein(CharSequence a, CharSequence b) {
        return LEVENSHTEIN.apply(a, b);
    }

    /**
     * Levenshtein distance that also counts a swap of two adjacent characters as one edit
     * (optimal string alignment: no substring is edited twice).
     */
    public static int damerauLevenshtein(CharSequence a, CharSequence b) {
        final int n = a.length();
        final int m = b.length();
        int[][] d = new int[n + 1][m + 1];

        for (int i = 0; i <= n; i++) d[i][0] = i;
        for (int j = 0; j <= m; j++) d[0][j] = j;

        for (int i = 1; i <= n; i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= m; j++) {
                char cb = b.charAt(j - 1);
                int cost = (ca == cb) ? 0 : 1;
                d[i][j] = Math.min(Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1), d[i - 1][j - 1] + cost);
                if (i > 1 && j > 1 && ca == b.charAt(j - 2) && a.charAt(i - 2) == cb) {
                    d[i][j] = Math.min(d[i][j], d[i - 2][j - 2] + cost);
                }
            }
        }
        return d[n][m];
    }

    public static int commonPrefixLength(CharSequence a, CharSequence b) {
        int max = Math.min(a.length(), b.length());
        int i = 0;
        while (i < max && a.charAt(i) == b.charAt(i)) i++;
        return i;
    }
}
