package com.spellcheck.service;

import com.spellcheck.data.WordLookup;
import org.apache.commons.text.similarity.LevenshteinDistance;

import java.util.*;

/**
 * Generates and ranks correction candidates for a misspelled word.
 *
 * <p>The engine only reads through its {@link WordLookup}; it keeps no per-call state and caches nothing,
 * so every call reflects the current dictionary and configuration. Thread-safety is the caller's concern.
 *
 * <p>Score of a candidate {@code c} for input {@code w}:
 * <pre>
 *   editWeight   * 1 / (1 + distance(w, c))
 * + freqWeight   * ln(1 + frequency(c)) / 10
 * + 0.1          * min(|w|, |c|) / max(|w|, |c|)
 * + prefixWeight * commonPrefix(w, c) / |w|
 * </pre>
 * The phonetic weight is carried as configuration only and does not enter the score.
 */
public class SuggestionEngine {

    static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz";
    private static final double LENGTH_RATIO_WEIGHT = 0.1;
    private static final int MIN_PREFIX_LENGTH = 3;

    private final WordLookup dictionary;

    private int maxEditDistance = 2;
    private int maxSuggestions = 10;
    private double editDistanceWeight = 1.0;
    private double frequencyWeight = 0.5;
    private double phoneticWeight = 0.3;
    private double prefixWeight = 0.2;
    private int prefixResultsPerQuery = 20;
    private int maxPrefixCandidates = 50;
    private DistanceMetric distanceMetric = DistanceMetric.LEVENSHTEIN;

    public SuggestionEngine(WordLookup dictionary) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
    }

    /**
     * Ranked corrections for {@code word}, best first, at most {@link #getMaxSuggestions()}.
     */
    public List<String> suggest(String word) {
        List<Suggestion> ranked = rank(word);
        List<String> out = new ArrayList<>(ranked.size());
        for (Suggestion s : ranked) out.add(s.getText());
        return out;
    }

    /**
     * Same as {@link #suggest(String)} but keeps frequency and score with each candidate.
     */
    public List<Suggestion> rank(String word) {
        if (word == null || word.isEmpty()) return Collections.emptyList();
        String w = word.toLowerCase(Locale.ROOT);

        Set<String> candidates = new LinkedHashSet<>();
        addKnown(candidates, deletions(w));
        addKnown(candidates, insertions(w));
        addKnown(candidates, substitutions(w));
        addKnown(candidates, transpositions(w));
        candidates.addAll(splits(w));
        candidates.addAll(phoneticSuggestions(w));
        candidates.addAll(prefixSuggestions(w));

        return rankCandidates(w, candidates);
    }

    /**
     * Exhaustive scan of the dictionary for words within {@code maxDistance} Levenshtein edits,
     * closest first, then most frequent, then lexicographic. Cost grows with dictionary size.
     */
    public List<String> suggestByEditDistance(String word, int maxDistance) {
        if (word == null || maxDistance < 0) return Collections.emptyList();
        String w = word.toLowerCase(Locale.ROOT);
        LevenshteinDistance bounded = new LevenshteinDistance(maxDistance);

        List<Scored> matches = new ArrayList<>();
        for (String candidate : dictionary.allWords()) {
            int d = bounded.apply(w, candidate);
            if (d != -1) {
                matches.add(new Scored(candidate, d, dictionary.frequency(candidate)));
            }
        }
        matches.sort(Comparator.comparingInt(Scored::distance)
                .thenComparing(Comparator.comparingLong(Scored::frequency).reversed())
                .thenComparing(Scored::word));

        List<String> out = new ArrayList<>();
        for (Scored s : matches) {
            if (out.size() >= maxSuggestions) break;
            out.add(s.word());
        }
        return out;
    }

    public List<String> suggestByEditDistance(String word) {
        return suggestByEditDistance(word, maxEditDistance);
    }

    public List<String> phoneticSuggestions(String word) {
        if (word == null || word.isEmpty()) return Collections.emptyList();
        return dictionary.phoneticMatches(word.toLowerCase(Locale.ROOT));
    }

    /**
     * Completions of the word's own prefixes, longest prefix first, down to three characters
     * (or the whole word when shorter). Each prefix query is capped at {@link #getPrefixResultsPerQuery()}
     * and collection stops at {@link #getMaxPrefixCandidates()} distinct words.
     */
    public List<String> prefixSuggestions(String word) {
        if (word == null || word.isEmpty()) return Collections.emptyList();
        String w = word.toLowerCase(Locale.ROOT);

        Set<String> out = new LinkedHashSet<>();
        int shortest = Math.min(w.length(), MIN_PREFIX_LENGTH);
        for (int len = w.length(); len >= shortest && out.size() < maxPrefixCandidates; len--) {
            for (String match : dictionary.wordsWithPrefix(w.substring(0, len), prefixResultsPerQuery)) {
                if (out.size() >= maxPrefixCandidates) break;
                out.add(match);
            }
        }
        return new ArrayList<>(out);
    }

    public double score(String original, String candidate) {
        double score = 0.0;

        int distance = distanceMetric.between(original, candidate);
        score += editDistanceWeight * (1.0 / (1.0 + distance));

        long frequency = dictionary.frequency(candidate);
        score += frequencyWeight * (Math.log1p(frequency) / 10.0);

        int longer = Math.max(original.length(), candidate.length());
        if (longer > 0) {
            int shorter = Math.min(original.length(), candidate.length());
            score += LENGTH_RATIO_WEIGHT * ((double) shorter / longer);
        }

        if (!original.isEmpty()) {
            int common = EditDistance.commonPrefixLength(original, candidate);
            score += prefixWeight * ((double) common / original.length());
        }
        return score;
    }

    List<Suggestion> rankCandidates(String word, Collection<String> candidates) {
        List<Suggestion> scored = new ArrayList<>(candidates.size());
        for (String candidate : candidates) {
            scored.add(new Suggestion(candidate, dictionary.frequency(candidate), score(word, candidate)));
        }
        scored.sort(Comparator.comparingDouble(Suggestion::getScore).reversed()
                .thenComparing(Suggestion::getText));
        return scored.size() > maxSuggestions ? new ArrayList<>(scored.subList(0, maxSuggestions)) : scored;
    }

    // --- candidate generators ---

    static List<String> deletions(String word) {
        List<String> out = new ArrayList<>(word.length());
        for (int i = 0; i < word.length(); i++) {
            out.add(word.substring(0, i) + word.substring(i + 1));
        }
        return out;
    }

    static List<String> insertions(String word) {
        List<String> out = new ArrayList<>((word.length() + 1) * ALPHABET.length());
        for (int i = 0; i <= word.length(); i++) {
            String head = word.substring(0, i);
            String tail = word.substring(i);
            for (int k = 0; k < ALPHABET.length(); k++) {
                out.add(head + ALPHABET.charAt(k) + tail);
            }
        }
        return out;
    }

    static List<String> substitutions(String word) {
        List<String> out = new ArrayList<>(word.length() * (ALPHABET.length() - 1));
        char[] chars = word.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            char original = chars[i];
            for (int k = 0; k < ALPHABET.length(); k++) {
                char c = ALPHABET.charAt(k);
                if (c == original) continue;
                chars[i] = c;
                out.add(new String(chars));
            }
            chars[i] = original;
        }
        return out;
    }

    static List<String> transpositions(String word) {
        List<String> out = new ArrayList<>();
        char[] chars = word.toCharArray();
        for (int i = 0; i + 1 < chars.length; i++) {
            swap(chars, i, i + 1);
            out.add(new String(chars));
            swap(chars, i, i + 1);
        }
        return out;
    }

    /**
     * Two-word candidates {@code "first second"} for each split point where both halves are known words.
     */
    List<String> splits(String word) {
        List<String> out = new ArrayList<>();
        for (int i = 1; i < word.length(); i++) {
            String first = word.substring(0, i);
            String second = word.substring(i);
            if (dictionary.contains(first) && dictionary.contains(second)) {
                out.add(first + " " + second);
            }
        }
        return out;
    }

    private void addKnown(Set<String> into, List<String> generated) {
        for (String candidate : generated) {
            if (dictionary.contains(candidate)) into.add(candidate);
        }
    }

    private static void swap(char[] chars, int i, int j) {
        char tmp = chars[i];
        chars[i] = chars[j];
        chars[j] = tmp;
    }

    private record Scored(String word, int distance, long frequency) {}

    // --- configuration ---

    public int getMaxEditDistance() {
        return maxEditDistance;
    }

    public void setMaxEditDistance(int maxEditDistance) {
        if (maxEditDistance < 0) throw new IllegalArgumentException("maxEditDistance must not be negative");
        this.maxEditDistance = maxEditDistance;
    }

    public int getMaxSuggestions() {
        return maxSuggestions;
    }

    public void setMaxSuggestions(int maxSuggestions) {
        if (maxSuggestions < 0) throw new IllegalArgumentException("maxSuggestions must not be negative");
        this.maxSuggestions = maxSuggestions;
    }

    public double getEditDistanceWeight() {
        return editDistanceWeight;
    }

    public void setEditDistanceWeight(double editDistanceWeight) {
        this.editDistanceWeight = editDistanceWeight;
    }

    public double getFrequencyWeight() {
        return frequencyWeight;
    }

    public void setFrequencyWeight(double frequencyWeight) {
        this.frequencyWeight = frequencyWeight;
    }

    public double getPhoneticWeight() {
        return phoneticWeight;
    }

    public void setPhoneticWeight(double phoneticWeight) {
        this.phoneticWeight = phoneticWeight;
    }

    public double getPrefixWeight() {
        return prefixWeight;
    }

    public void setPrefixWeight(double prefixWeight) {
        this.prefixWeight = prefixWeight;
    }

    public int getPrefixResultsPerQuery() {
        return prefixResultsPerQuery;
    }

    public void setPrefixResultsPerQuery(int prefixResultsPerQuery) {
        this.prefixResultsPerQuery = prefixResultsPerQuery;
    }

    public int getMaxPrefixCandidates() {
        return maxPrefixCandidates;
    }

    public void setMaxPrefixCandidates(int maxPrefixCandidates) {
        this.maxPrefixCandidates = maxPrefixCandidates;
    }

    public DistanceMetric getDistanceMetric() {
        return distanceMetric;
    }

    public void setDistanceMetric(DistanceMetric distanceMetric) {
        this.distanceMetric = Objects.requireNonNull(distanceMetric, "distanceMetric");
    }
}
