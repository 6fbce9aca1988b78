package com.spellcheck.data;

import java.util.List;
import java.util.Set;

/**
 * Read-only view of a dictionary.
 *
 * <p>Holders of a {@code WordLookup} never own the underlying index; whoever created the index
 * keeps it alive and serializes mutations against these queries.
 */
public interface WordLookup {

    boolean contains(String word);

    /** Frequency of {@code word}, 0 when absent. */
    long frequency(String word);

    /**
     * Words starting with {@code prefix}, most frequent first (ties in lexicographic order).
     */
    List<String> wordsWithPrefix(String prefix, int maxResults);

    /** Words sharing the phonetic code of {@code word}, in insertion order. */
    List<String> phoneticMatches(String word);

    Set<String> allWords();
}
