package com.spellcheck.service;

import com.spellcheck.config.SpellCheckProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TextTokenizerTest {

    private final TextTokenizer tokenizer = new TextTokenizer(SpellCheckProperties.Text.defaults());

    @Test
    void tracksOffsetLineAndColumn() {
        List<WordToken> tokens = tokenizer.extractWords("Helo world\nthis iz fine");

        assertEquals(List.of(
                new WordToken("helo", 0, 1, 1),
                new WordToken("world", 5, 1, 6),
                new WordToken("this", 11, 2, 1),
                new WordToken("fine", 19, 2, 9)), tokens);
    }

    @Test
    void skipsWordsInsideUrlsAndEmails() {
        List<String> words = words("visit https://exmaple.com or mail bob@exmaple.org today");

        assertEquals(List.of("visit", "mail", "today"), words);
    }

    @Test
    void keepsUrlWordsWhenNotIgnored() {
        TextTokenizer lenient = new TextTokenizer(new SpellCheckProperties.Text(false, false, true, 3, 3));

        List<String> words = lenient.extractWords("see www.exmaple.com").stream()
                .map(WordToken::word).collect(Collectors.toList());

        assertEquals(List.of("see", "www", "exmaple", "com"), words);
    }

    @Test
    void keepsContractionsTogether() {
        assertEquals(List.of("don't", "panic"), words("Don't PANIC!"));
    }

    @Test
    void ignoresNumbersShortAndNonAlphabeticTokens() {
        assertTrue(tokenizer.shouldIgnoreWord("123"));
        assertTrue(tokenizer.shouldIgnoreWord("3.14"));
        assertTrue(tokenizer.shouldIgnoreWord("ab"));
        assertTrue(tokenizer.shouldIgnoreWord("ab1c"));
        assertTrue(tokenizer.shouldIgnoreWord("someone@example.com"));
        assertTrue(tokenizer.shouldIgnoreWord("example.com"));
        assertTrue(tokenizer.shouldIgnoreWord(""));
        assertFalse(tokenizer.shouldIgnoreWord("abc"));
        assertFalse(tokenizer.shouldIgnoreWord("it's"));
    }

    @Test
    void normalizationStripsPunctuationAndLowercases() {
        assertEquals("hello", tokenizer.normalizeWord("Hello!"));
        assertEquals("o'neil", tokenizer.normalizeWord("(O'Neil)"));
    }

    @Test
    void textUtilities() {
        assertEquals(List.of("One", "Two", "Three?"), tokenizer.splitIntoSentences("One. Two!  Three?"));
        assertEquals(3, tokenizer.countLines("a\nb\nc"));
        assertEquals(2, tokenizer.countWords("the cat is"));
        assertTrue(tokenizer.extractWords("").isEmpty());
        assertTrue(tokenizer.extractWords(null).isEmpty());
    }

    private List<String> words(String text) {
        return tokenizer.extractWords(text).stream().map(WordToken::word).collect(Collectors.toList());
    }
}
