package com.spellcheck.data;

import com.spellcheck.config.SpellCheckProperties;
import com.spellcheck.service.SpellCheckService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Fills the dictionary at start-up: the configured file when there is one, the bundled dictionary otherwise.
 *
 * <p>A configured file that is missing or unreadable falls back to the bundled dictionary. A configured file
 * with a malformed entry is not replaced: the {@link DictionaryFormatException} propagates and start-up fails.
 */
@Slf4j
@Component
public class DictionaryLoader implements CommandLineRunner {

    private final ResourceLoader resourceLoader;
    private final SpellCheckService spellCheckService;
    private final SpellCheckProperties properties;

    public DictionaryLoader(ResourceLoader resourceLoader,
                            SpellCheckService spellCheckService,
                            SpellCheckProperties properties) {
        this.resourceLoader = resourceLoader;
        this.spellCheckService = spellCheckService;
        this.properties = properties;
    }

    @Override
    public void run(String... args) throws Exception {
        String configured = properties.dictionaryPath();
        if (configured != null && !configured.isBlank()) {
            Path path = Path.of(configured);
            if (Files.isReadable(path)) {
                try {
                    if (spellCheckService.loadDictionary(path)) {
                        log.info("Dictionary ready: {} words from {}", spellCheckService.stats().wordCount(), path);
                        return;
                    }
                } catch (DictionaryFormatException e) {
                    log.error("Configured dictionary {} has a malformed entry #{}", path, e.getEntryNumber());
                    throw e;
                }
            }
            log.warn("Configured dictionary {} is missing or unreadable, loading the bundled one", path);
        }

        Resource resource = resourceLoader.getResource(SpellCheckProperties.BUNDLED_DICTIONARY);
        if (!resource.exists()) {
            log.warn("No bundled dictionary found at {}; starting empty", SpellCheckProperties.BUNDLED_DICTIONARY);
            return;
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            spellCheckService.loadDictionary(reader);
        }
        log.info("Dictionary ready: {} words from {}", spellCheckService.stats().wordCount(),
                SpellCheckProperties.BUNDLED_DICTIONARY);
    }
}
