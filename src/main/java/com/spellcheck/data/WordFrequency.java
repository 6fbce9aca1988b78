package com.spellcheck.data;

/**
 * A dictionary word paired with its frequency.
 */
public record WordFrequency(String word, long frequency) {
}
