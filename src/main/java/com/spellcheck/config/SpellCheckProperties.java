package com.spellcheck.config;

import com.spellcheck.service.DistanceMetric;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Spell checker configuration.
 *
 * <p>Example YAML:
 * <pre>
 * spellcheck:
 *   dictionary-path: /var/lib/spellcheck/en_US.dict
 *   dictionary-dir: /var/lib/spellcheck
 *   engine:
 *     max-suggestions: 5
 *   text:
 *     ignore-numbers: false
 * </pre>
 */
@ConfigurationProperties(prefix = "spellcheck")
public record SpellCheckProperties(
        String dictionaryPath,
        @DefaultValue("dictionaries") String dictionaryDir,
        @DefaultValue Engine engine,
        @DefaultValue Text text) {

    /** Classpath dictionary used when {@code dictionary-path} is unset or unreadable. */
    public static final String BUNDLED_DICTIONARY = "classpath:dictionaries/en_US.dict";

    /** The only directory the dictionary save/load API may read from or write to. */
    public static final String DEFAULT_DICTIONARY_DIR = "dictionaries";

    public SpellCheckProperties {
        if (dictionaryDir == null || dictionaryDir.isBlank()) dictionaryDir = DEFAULT_DICTIONARY_DIR;
        if (engine == null) engine = Engine.defaults();
        if (text == null) text = Text.defaults();
    }

    public static SpellCheckProperties defaults() {
        return new SpellCheckProperties(null, DEFAULT_DICTIONARY_DIR, Engine.defaults(), Text.defaults());
    }

    /** Suggestion engine tuning. */
    public record Engine(
            @DefaultValue("2") int maxEditDistance,
            @DefaultValue("10") int maxSuggestions,
            @DefaultValue("1.0") double editDistanceWeight,
            @DefaultValue("0.5") double frequencyWeight,
            @DefaultValue("0.3") double phoneticWeight,
            @DefaultValue("0.2") double prefixWeight,
            @DefaultValue("20") int prefixResultsPerQuery,
            @DefaultValue("50") int maxPrefixCandidates,
            @DefaultValue("LEVENSHTEIN") DistanceMetric distanceMetric) {

        public Engine {
            if (distanceMetric == null) distanceMetric = DistanceMetric.LEVENSHTEIN;
        }

        public static Engine defaults() {
            return new Engine(2, 10, 1.0, 0.5, 0.3, 0.2, 20, 50, DistanceMetric.LEVENSHTEIN);
        }
    }

    /** Which tokens of a text are checked, and how many suggestions each misspelling gets. */
    public record Text(
            @DefaultValue("true") boolean ignoreUrls,
            @DefaultValue("true") boolean ignoreEmails,
            @DefaultValue("true") boolean ignoreNumbers,
            @DefaultValue("3") int minWordLength,
            @DefaultValue("3") int suggestionsPerMisspelling) {

        public static Text defaults() {
            return new Text(true, true, true, 3, 3);
        }
    }
}
