package com.spellcheck.data;

/**
 * Size of a {@link WordIndex}. The memory figure counts the bytes of the strings held by the word set,
 * the frequency map and the phonetic buckets; trie nodes are not included.
 */
public record IndexStats(long wordCount, long approximateMemoryBytes) {
}
