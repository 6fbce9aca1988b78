package com.spellcheck.service;

import com.spellcheck.config.SpellCheckProperties;
import com.spellcheck.data.IndexStats;
import com.spellcheck.data.PhoneticCode;
import com.spellcheck.data.WordIndex;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Front door of the spell checker. Owns the dictionary and the suggestion engine bound to it,
 * and serializes access: queries share the read lock, mutations and loads take the write lock.
 */
@Slf4j
@Service
public class SpellCheckService {

    private final WordIndex index = new WordIndex();
    private final SuggestionEngine engine;
    private final TextTokenizer tokenizer;
    private final int suggestionsPerMisspelling;
    private final Path dictionaryDir;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final MeterRegistry meterRegistry;

    @Autowired
    public SpellCheckService(SpellCheckProperties properties, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.tokenizer = new TextTokenizer(properties.text());
        this.suggestionsPerMisspelling = properties.text().suggestionsPerMisspelling();
        this.dictionaryDir = Path.of(properties.dictionaryDir()).toAbsolutePath().normalize();
        this.engine = new SuggestionEngine(index);

        SpellCheckProperties.Engine cfg = properties.engine();
        engine.setMaxEditDistance(cfg.maxEditDistance());
        engine.setMaxSuggestions(cfg.maxSuggestions());
        engine.setEditDistanceWeight(cfg.editDistanceWeight());
        engine.setFrequencyWeight(cfg.frequencyWeight());
        engine.setPhoneticWeight(cfg.phoneticWeight());
        engine.setPrefixWeight(cfg.prefixWeight());
        engine.setPrefixResultsPerQuery(cfg.prefixResultsPerQuery());
        engine.setMaxPrefixCandidates(cfg.maxPrefixCandidates());
        engine.setDistanceMetric(cfg.distanceMetric());
    }

    /**
     * True when the token is in the dictionary or is not something we check (URL, number, too short...).
     */
    public boolean isCorrect(String token) {
        if (token == null || token.isEmpty() || tokenizer.shouldIgnoreWord(token)) return true;
        boolean found;
        lock.readLock().lock();
        try {
            found = index.contains(tokenizer.normalizeWord(token));
        } finally {
            lock.readLock().unlock();
        }
        if (meterRegistry != null)
            meterRegistry.counter("spellcheck.checks", "result", found ? "correct" : "misspelled").increment();
        return found;
    }

    public List<String> suggestions(String token) {
        List<Suggestion> ranked = rank(token);
        List<String> out = new ArrayList<>(ranked.size());
        for (Suggestion s : ranked) out.add(s.getText());
        return out;
    }

    public List<Suggestion> rank(String token) {
        if (token == null || token.isBlank()) return Collections.emptyList();
        long start = System.currentTimeMillis();
        String normalized = tokenizer.normalizeWord(token);
        List<Suggestion> ranked;
        lock.readLock().lock();
        try {
            ranked = engine.rank(normalized);
        } finally {
            lock.readLock().unlock();
        }
        long took = System.currentTimeMillis() - start;
        if (meterRegistry != null) {
            meterRegistry.counter("spellcheck.suggest.requests").increment();
            meterRegistry.timer("spellcheck.suggest.latency").record(took, TimeUnit.MILLISECONDS);
        }
        log.debug("Ranked {} suggestions for '{}' in {} ms", ranked.size(), normalized, took);
        return ranked;
    }

    public List<String> suggestByEditDistance(String token, int maxDistance) {
        if (token == null || token.isBlank()) return Collections.emptyList();
        String normalized = tokenizer.normalizeWord(token);
        lock.readLock().lock();
        try {
            return engine.suggestByEditDistance(normalized, maxDistance);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getMaxEditDistance() {
        return engine.getMaxEditDistance();
    }

    /**
     * Misspelled words of {@code text} with their positions and top suggestions.
     */
    public List<Misspelling> checkText(String text) {
        List<WordToken> tokens = tokenizer.extractWords(text);
        List<Misspelling> out = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (WordToken token : tokens) {
                if (index.contains(token.word())) continue;
                List<String> suggestions = engine.suggest(token.word());
                if (suggestions.size() > suggestionsPerMisspelling) {
                    suggestions = new ArrayList<>(suggestions.subList(0, suggestionsPerMisspelling));
                }
                out.add(new Misspelling(token.word(), token.offset(), token.line(), token.column(), suggestions));
            }
        } finally {
            lock.readLock().unlock();
        }
        if (meterRegistry != null) {
            meterRegistry.counter("spellcheck.checks", "result", "correct").increment(tokens.size() - out.size());
            meterRegistry.counter("spellcheck.checks", "result", "misspelled").increment(out.size());
        }
        return out;
    }

    /**
     * @throws UncheckedIOException when the file cannot be read
     */
    public List<Misspelling> checkFile(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read file: " + path, e);
        }
        return checkText(content);
    }

    public void addWord(String word) {
        addWord(word, 1L);
    }

    public void addWord(String word, long frequency) {
        if (word == null || word.isBlank()) return;
        lock.writeLock().lock();
        try {
            index.insert(word.trim(), frequency);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Added '{}' (frequency {})", word, frequency);
    }

    public boolean removeWord(String word) {
        if (word == null || word.isBlank()) return false;
        lock.writeLock().lock();
        try {
            return index.remove(word.trim());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<String> wordsWithPrefix(String prefix, int limit) {
        lock.readLock().lock();
        try {
            return index.wordsWithPrefix(prefix, limit);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> phoneticMatches(String word) {
        if (word == null || word.isBlank()) return Collections.emptyList();
        lock.readLock().lock();
        try {
            return engine.phoneticSuggestions(word.trim());
        } finally {
            lock.readLock().unlock();
        }
    }

    public String phoneticCode(String word) {
        return PhoneticCode.encode(word == null ? null : word.trim());
    }

    public long frequency(String word) {
        lock.readLock().lock();
        try {
            return index.frequency(word);
        } finally {
            lock.readLock().unlock();
        }
    }

    public IndexStats stats() {
        lock.readLock().lock();
        try {
            return index.stats();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Resolves a client-supplied dictionary file name inside the configured dictionary directory.
     *
     * @throws IllegalArgumentException when the name is blank or points outside that directory
     */
    public Path resolveDictionaryFile(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("dictionary file name is required");
        Path resolved;
        try {
            resolved = dictionaryDir.resolve(name).normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("invalid dictionary file name: " + name, e);
        }
        if (!resolved.startsWith(dictionaryDir) || resolved.equals(dictionaryDir)) {
            log.warn("Rejected dictionary file outside {}: {}", dictionaryDir, name);
            throw new IllegalArgumentException("dictionary file must be inside the dictionary directory");
        }
        return resolved;
    }

    /**
     * @return false when the file cannot be opened
     * @throws com.spellcheck.data.DictionaryFormatException on a malformed entry; the dictionary is unchanged
     */
    public boolean loadDictionary(Path path) {
        lock.writeLock().lock();
        try {
            return index.loadFromFile(path);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void loadDictionary(Reader reader) throws IOException {
        lock.writeLock().lock();
        try {
            index.load(reader);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean saveDictionary(Path path) {
        lock.readLock().lock();
        try {
            return index.saveToFile(path);
        } finally {
            lock.readLock().unlock();
        }
    }
}
