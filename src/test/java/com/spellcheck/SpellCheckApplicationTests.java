package com.spellcheck;

import com.spellcheck.service.SpellCheckService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class SpellCheckApplicationTests {

    @Autowired
    private SpellCheckService spellCheckService;

    @Test
    void bundledDictionaryLoadedAtStartup() {
        assertTrue(spellCheckService.stats().wordCount() > 100);
        assertTrue(spellCheckService.isCorrect("the"));
        assertFalse(spellCheckService.isCorrect("teh"));
        assertTrue(spellCheckService.suggestions("teh").contains("the"));
    }
}
