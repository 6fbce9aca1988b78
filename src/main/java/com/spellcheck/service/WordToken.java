package com.spellcheck.service;

/**
 * A normalized word found in a text, with its character offset and 1-based line/column.
 */
public record WordToken(String word, int offset, int line, int column) {
}
