package com.spellcheck.data;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * In-memory dictionary combining a trie (prefix queries), a hash set (membership),
 * a frequency map and phonetic buckets (sound-alike queries).
 *
 * <p>Words are lowercased on the way in. The hash set is the authority on membership; the trie,
 * frequency map and buckets are kept in step with it on insert and remove.
 *
 * <p>No internal locking: callers that share an instance between threads must guard it themselves,
 * shared for queries and exclusive for {@link #insert}, {@link #remove}, {@link #clear} and loads.
 */
@Slf4j
public class WordIndex implements WordLookup {

    /** Dictionary file: one {@code word} or {@code word:frequency} per line. */
    static final CSVFormat DICTIONARY_FORMAT = CSVFormat.DEFAULT.builder()
            .setDelimiter(':')
            .setQuote(null)
            .setTrim(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .setRecordSeparator('\n')
            .build();

    private static final long DEFAULT_FREQUENCY = 1L;

    private final WordTrie trie = new WordTrie();
    private final Set<String> words = new HashSet<>();
    private final Map<String, Long> frequencies = new HashMap<>();
    private final Map<String, List<String>> phoneticBuckets = new HashMap<>();

    public void insert(String word) {
        insert(word, DEFAULT_FREQUENCY);
    }

    /**
     * Adds {@code word} or, if present, overwrites its frequency. Empty input is ignored.
     *
     * @throws IllegalArgumentException for a negative frequency, or a word holding {@code ':'} or a line break,
     *                                  which the dictionary file format cannot represent
     */
    public void insert(String word, long frequency) {
        if (word == null || word.isEmpty()) return;
        if (frequency < 0) {
            throw new IllegalArgumentException("frequency must not be negative: " + frequency);
        }
        if (!isStorable(word)) {
            throw new IllegalArgumentException("word must not contain ':' or line breaks");
        }
        String normalized = normalize(word);

        boolean added = words.add(normalized);
        frequencies.put(normalized, frequency);
        trie.insert(normalized, frequency);
        if (added) {
            phoneticBuckets.computeIfAbsent(PhoneticCode.encode(normalized), k -> new ArrayList<>())
                    .add(normalized);
        }
    }

    /**
     * Removes {@code word} from every structure.
     *
     * @return false when the word was not present
     */
    public boolean remove(String word) {
        if (word == null || word.isEmpty()) return false;
        String normalized = normalize(word);
        if (!words.remove(normalized)) return false;

        frequencies.remove(normalized);
        trie.remove(normalized);

        String code = PhoneticCode.encode(normalized);
        List<String> bucket = phoneticBuckets.get(code);
        if (bucket != null) {
            bucket.remove(normalized);
            if (bucket.isEmpty()) phoneticBuckets.remove(code);
        }
        return true;
    }

    @Override
    public boolean contains(String word) {
        if (word == null || word.isEmpty()) return false;
        return words.contains(normalize(word));
    }

    @Override
    public long frequency(String word) {
        if (word == null || word.isEmpty()) return 0L;
        return frequencies.getOrDefault(normalize(word), 0L);
    }

    /**
     * Collects up to {@code maxResults} words under the prefix (lexicographic depth-first walk),
     * then orders that set by frequency descending, ties lexicographically.
     */
    @Override
    public List<String> wordsWithPrefix(String prefix, int maxResults) {
        String normalized = prefix == null ? "" : normalize(prefix);
        List<WordFrequency> found = new ArrayList<>(trie.collect(normalized, maxResults));
        found.sort(Comparator.comparingLong(WordFrequency::frequency).reversed()
                .thenComparing(WordFrequency::word));
        List<String> out = new ArrayList<>(found.size());
        for (WordFrequency wf : found) out.add(wf.word());
        return out;
    }

    @Override
    public List<String> phoneticMatches(String word) {
        List<String> bucket = phoneticBuckets.get(PhoneticCode.encode(word));
        return bucket == null ? Collections.emptyList() : List.copyOf(bucket);
    }

    @Override
    public Set<String> allWords() {
        return Set.copyOf(words);
    }

    public int size() {
        return words.size();
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    public void clear() {
        words.clear();
        frequencies.clear();
        phoneticBuckets.clear();
        trie.clear();
    }

    public IndexStats stats() {
        long bytes = 0L;
        for (String w : words) {
            bytes += w.length();
        }
        for (String w : frequencies.keySet()) {
            bytes += w.length();
        }
        for (Map.Entry<String, List<String>> e : phoneticBuckets.entrySet()) {
            bytes += e.getKey().length();
            for (String w : e.getValue()) bytes += w.length();
        }
        return new IndexStats(words.size(), bytes);
    }

    /**
     * Replaces the contents with the dictionary file at {@code path}.
     *
     * @return false when the file cannot be opened or read; the index is then left untouched
     * @throws DictionaryFormatException when an entry carries a malformed frequency; the index is left untouched
     */
    public boolean loadFromFile(Path path) {
        if (!Files.isReadable(path)) {
            log.warn("Dictionary file not readable: {}", path);
            return false;
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            load(reader);
            log.info("Loaded {} words from {}", size(), path);
            return true;
        } catch (IOException e) {
            log.warn("Failed to read dictionary {}: {}", path, e.getMessage());
            return false;
        }
    }

    /**
     * Replaces the contents with the entries read from {@code reader}. All entries are parsed before
     * the index is cleared, so a malformed entry leaves the previous contents in place.
     */
    public void load(Reader reader) throws IOException {
        List<WordFrequency> entries = new ArrayList<>();
        try (CSVParser parser = DICTIONARY_FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                entries.add(parseEntry(record));
            }
        }
        clear();
        for (WordFrequency entry : entries) {
            insert(entry.word(), entry.frequency());
        }
    }

    /**
     * Writes every entry as {@code word:frequency}, sorted by word.
     *
     * @return false when the destination cannot be opened or written
     */
    public boolean saveToFile(Path path) {
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            save(writer);
            log.info("Saved {} words to {}", size(), path);
            return true;
        } catch (IOException e) {
            log.warn("Failed to write dictionary {}: {}", path, e.getMessage());
            return false;
        }
    }

    public void save(Writer writer) throws IOException {
        CSVPrinter printer = new CSVPrinter(writer, DICTIONARY_FORMAT);
        for (String word : new TreeSet<>(frequencies.keySet())) {
            printer.printRecord(word, frequencies.get(word));
        }
        printer.flush();
    }

    private static WordFrequency parseEntry(CSVRecord record) {
        String word = record.get(0);
        if (record.size() == 1) {
            return new WordFrequency(word, DEFAULT_FREQUENCY);
        }
        if (record.size() == 2) {
            try {
                long frequency = Long.parseLong(record.get(1));
                if (frequency >= 0) return new WordFrequency(word, frequency);
            } catch (NumberFormatException e) {
                throw new DictionaryFormatException(record.getRecordNumber(), String.join(":", record), e);
            }
        }
        throw new DictionaryFormatException(record.getRecordNumber(), String.join(":", record), null);
    }

    /** True when {@code word} survives a save/load round trip of the {@code word[:freq]} format. */
    public static boolean isStorable(String word) {
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (c == ':' || c == '\n' || c == '\r') return false;
        }
        return true;
    }

    private static String normalize(String word) {
        return word.toLowerCase(Locale.ROOT);
    }

    // package-private for consistency checks in tests
    WordTrie trie() {
        return trie;
    }
}
