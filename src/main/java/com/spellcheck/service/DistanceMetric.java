package com.spellcheck.service;

/**
 * Distance used by the edit-distance term of the suggestion score.
 */
public enum DistanceMetric {

    LEVENSHTEIN {
        @Override
        public int between(String a, String b) {
            return EditDistance.levenshtein(a, b);
        }
    },

    /** Also counts an adjacent transposition as a single edit. */
    DAMERAU_LEVENSHTEIN {
        @Override
        public int between(String a, String b) {
            return EditDistance.damerauLevenshtein(a, b);
        }
    };

    public abstract int between(String a, String b);
}
