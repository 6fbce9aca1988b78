package com.spellcheck.config;

import com.spellcheck.service.SpellCheckService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;

/**
 * Dictionary gauges, sampled on scrape so they follow loads, additions and removals.
 */
@Configuration
public class MetricsConfig {

    public static final String DICTIONARY_WORDS = "spellcheck.dictionary.words";
    public static final String DICTIONARY_BYTES = "spellcheck.dictionary.bytes";

    @Autowired
    public MetricsConfig(MeterRegistry registry, SpellCheckService spellCheckService) {
        Gauge.builder(DICTIONARY_WORDS, spellCheckService, s -> s.stats().wordCount())
                .description("Words in the dictionary")
                .register(registry);
        Gauge.builder(DICTIONARY_BYTES, spellCheckService, s -> s.stats().approximateMemoryBytes())
                .description("Approximate bytes held by the dictionary's word strings")
                .baseUnit("bytes")
                .register(registry);
    }
}
