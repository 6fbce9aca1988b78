package com.spellcheck.service;

import java.util.List;

/**
 * A word of a checked text that is not in the dictionary, where it was found, and what it could be.
 */
public record Misspelling(String word, int offset, int line, int column, List<String> suggestions) {
}
