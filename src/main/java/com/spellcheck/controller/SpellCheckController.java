package com.spellcheck.controller;

import com.spellcheck.data.IndexStats;
import com.spellcheck.service.Misspelling;
import com.spellcheck.service.SpellCheckService;
import com.spellcheck.service.Suggestion;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class SpellCheckController {

    private final SpellCheckService spellCheckService;
    private final MeterRegistry meterRegistry;

    @Autowired
    public SpellCheckController(SpellCheckService spellCheckService, MeterRegistry meterRegistry) {
        this.spellCheckService = spellCheckService;
        this.meterRegistry = meterRegistry;
    }

    @GetMapping("/check")
    public ResponseEntity<CheckResponse> check(@RequestParam("word") String word) {
        if (word == null || word.isBlank()) return ResponseEntity.badRequest().build();
        boolean correct = spellCheckService.isCorrect(word);
        List<String> suggestions = correct ? List.of() : spellCheckService.suggestions(word);
        return ResponseEntity.ok(new CheckResponse(word, correct, suggestions));
    }

    @PostMapping(value = "/check", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<List<Misspelling>> checkText(@RequestBody String text) {
        return ResponseEntity.ok(spellCheckService.checkText(text));
    }

    @GetMapping("/suggest")
    public ResponseEntity<List<Suggestion>> suggest(@RequestParam("word") String word) {
        if (word == null || word.isBlank()) return ResponseEntity.badRequest().build();
        return ResponseEntity.ok(spellCheckService.rank(word));
    }

    @GetMapping("/suggest/edit-distance")
    public ResponseEntity<List<String>> suggestByEditDistance(
            @RequestParam("word") String word,
            @RequestParam(value = "maxDistance", required = false) Integer maxDistance) {
        if (word == null || word.isBlank()) return ResponseEntity.badRequest().build();
        int distance = maxDistance == null ? spellCheckService.getMaxEditDistance() : maxDistance;
        if (distance < 0) return ResponseEntity.badRequest().build();
        return ResponseEntity.ok(spellCheckService.suggestByEditDistance(word, distance));
    }

    @GetMapping("/prefix")
    public ResponseEntity<List<String>> prefix(
            @RequestParam("prefix") String prefix,
            @RequestParam(value = "limit", defaultValue = "10") int limit) {
        return ResponseEntity.ok(spellCheckService.wordsWithPrefix(prefix, limit));
    }

    @GetMapping("/phonetic")
    public ResponseEntity<PhoneticResponse> phonetic(@RequestParam("word") String word) {
        if (word == null || word.isBlank()) return ResponseEntity.badRequest().build();
        return ResponseEntity.ok(new PhoneticResponse(word, spellCheckService.phoneticCode(word),
                spellCheckService.phoneticMatches(word)));
    }

    @PostMapping("/words")
    public ResponseEntity<Void> addWord(@RequestBody AddWordRequest req) {
        if (req == null || req.word() == null || req.word().isBlank()) return ResponseEntity.badRequest().build();
        long frequency = req.frequency() == null ? 1L : req.frequency();
        if (frequency < 0) return ResponseEntity.badRequest().build();
        spellCheckService.addWord(req.word(), frequency);
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @DeleteMapping("/words/{word}")
    public ResponseEntity<Void> removeWord(@PathVariable("word") String word) {
        return spellCheckService.removeWord(word)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        IndexStats stats = spellCheckService.stats();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("wordCount", stats.wordCount());
        m.put("approximateMemoryBytes", stats.approximateMemoryBytes());
        m.put("correctChecks", count("spellcheck.checks", "correct"));
        m.put("misspelledChecks", count("spellcheck.checks", "misspelled"));
        m.put("suggestRequests", count("spellcheck.suggest.requests", null));
        return ResponseEntity.ok(m);
    }

    /**
     * {@code path} names a file inside the configured dictionary directory; anything outside it is a 400.
     */
    @PostMapping("/dictionary/save")
    public ResponseEntity<Void> save(@RequestParam("path") String path) {
        return spellCheckService.saveDictionary(spellCheckService.resolveDictionaryFile(path))
                ? ResponseEntity.ok().build()
                : ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }

    @PostMapping("/dictionary/load")
    public ResponseEntity<Map<String, Object>> load(@RequestParam("path") String path) {
        Path file = spellCheckService.resolveDictionaryFile(path);
        if (!spellCheckService.loadDictionary(file)) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(Map.of("wordCount", spellCheckService.stats().wordCount()));
    }

    private double count(String name, String result) {
        if (meterRegistry == null) return 0.0;
        Counter c = result == null
                ? meterRegistry.find(name).counter()
                : meterRegistry.find(name).tag("result", result).counter();
        return c == null ? 0.0 : c.count();
    }

    // DTOs
    public record CheckResponse(String word, boolean correct, List<String> suggestions) {}

    public record PhoneticResponse(String word, String code, List<String> matches) {}

    public record AddWordRequest(String word, Long frequency) {}
}
