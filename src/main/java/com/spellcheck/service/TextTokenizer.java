package com.spellcheck.service;

import com.spellcheck.config.SpellCheckProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw text into the word tokens the dictionary is checked against.
 *
 * <p>Words are runs of ASCII letters with at most one inner apostrophe ({@code don't}).
 * Words inside URLs and e-mail addresses are skipped when those are ignored, as are short
 * and non-alphabetic tokens.
 */
public class TextTokenizer {

    private static final Pattern WORD = Pattern.compile("[A-Za-z]+(?:'[A-Za-z]+)?");
    private static final Pattern URL =
            Pattern.compile("https?://\\S+|www\\.\\S+|[A-Za-z0-9][A-Za-z0-9-]*\\.[A-Za-z]{2,}");
    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+\\s+");

    private final SpellCheckProperties.Text settings;

    public TextTokenizer(SpellCheckProperties.Text settings) {
        this.settings = settings;
    }

    public List<WordToken> extractWords(String text) {
        if (text == null || text.isEmpty()) return Collections.emptyList();
        List<int[]> skipped = ignoredSpans(text);

        List<WordToken> out = new ArrayList<>();
        int line = 1;
        int lineStart = 0;
        int scanned = 0;
        Matcher m = WORD.matcher(text);
        while (m.find()) {
            int pos = m.start();
            for (; scanned < pos; scanned++) {
                if (text.charAt(scanned) == '\n') {
                    line++;
                    lineStart = scanned + 1;
                }
            }
            if (covers(skipped, pos)) continue;
            String raw = m.group();
            if (shouldIgnoreWord(raw)) continue;
            out.add(new WordToken(normalizeWord(raw), pos, line, pos - lineStart + 1));
        }
        return out;
    }

    /**
     * Drops everything but letters, digits and apostrophes, then lowercases.
     */
    public String normalizeWord(String word) {
        return removePunctuation(word).toLowerCase(Locale.ROOT);
    }

    public boolean shouldIgnoreWord(String word) {
        if (word == null || word.isEmpty()) return true;
        if (settings.ignoreUrls() && isUrl(word)) return true;
        if (settings.ignoreEmails() && isEmail(word)) return true;
        if (settings.ignoreNumbers() && isNumber(word)) return true;
        if (word.length() < settings.minWordLength()) return true;
        return !isAlphabetic(word);
    }

    public String removePunctuation(String word) {
        StringBuilder sb = new StringBuilder(word.length());
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '\'') sb.append(c);
        }
        return sb.toString();
    }

    public boolean isUrl(String text) {
        return URL.matcher(text).matches();
    }

    public boolean isEmail(String text) {
        return EMAIL.matcher(text).matches();
    }

    public boolean isNumber(String text) {
        return NUMBER.matcher(text).matches();
    }

    public boolean isAlphabetic(String word) {
        if (word.isEmpty()) return false;
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (!Character.isLetter(c) && c != '\'') return false;
        }
        return true;
    }

    public List<String> splitIntoSentences(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) return out;
        for (String s : SENTENCE_END.split(text)) {
            String trimmed = s.trim();
            if (!trimmed.isEmpty()) out.add(trimmed);
        }
        return out;
    }

    public int countWords(String text) {
        return extractWords(text).size();
    }

    public int countLines(String text) {
        if (text == null) return 0;
        int lines = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') lines++;
        }
        return lines;
    }

    private List<int[]> ignoredSpans(String text) {
        List<int[]> spans = new ArrayList<>();
        if (settings.ignoreEmails()) collectSpans(EMAIL, text, spans);
        if (settings.ignoreUrls()) collectSpans(URL, text, spans);
        return spans;
    }

    private static void collectSpans(Pattern pattern, String text, List<int[]> into) {
        Matcher m = pattern.matcher(text);
        while (m.find()) into.add(new int[]{m.start(), m.end()});
    }

    private static boolean covers(List<int[]> spans, int pos) {
        for (int[] span : spans) {
            if (pos >= span[0] && pos < span[1]) return true;
        }
        return false;
    }
}
