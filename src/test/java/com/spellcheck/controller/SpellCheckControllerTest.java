package com.spellcheck.controller;

import com.spellcheck.config.SpellCheckProperties;
import com.spellcheck.service.SpellCheckService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class SpellCheckControllerTest {

    @TempDir
    Path workDir;

    private Path dictionaryDir;
    private MockMvc mvc;

    @BeforeEach
    void setUp() throws Exception {
        dictionaryDir = Files.createDirectory(workDir.resolve("dictionaries"));
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        SpellCheckProperties properties = new SpellCheckProperties(null, dictionaryDir.toString(),
                SpellCheckProperties.Engine.defaults(), SpellCheckProperties.Text.defaults());
        SpellCheckService service = new SpellCheckService(properties, registry);
        service.loadDictionary(new StringReader("the:100\ncar:9\ncat:5\ncats:3\n"));
        mvc = MockMvcBuilders.standaloneSetup(new SpellCheckController(service, registry))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void checkMisspelledWord() throws Exception {
        mvc.perform(get("/api/check").param("word", "teh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.word").value("teh"))
                .andExpect(jsonPath("$.correct").value(false))
                .andExpect(jsonPath("$.suggestions[0]").value("the"));
    }

    @Test
    void checkCorrectWordHasNoSuggestions() throws Exception {
        mvc.perform(get("/api/check").param("word", "The"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.correct").value(true))
                .andExpect(jsonPath("$.suggestions", empty()));
    }

    @Test
    void blankWordRejected() throws Exception {
        mvc.perform(get("/api/check").param("word", " "))
                .andExpect(status().isBadRequest());
        mvc.perform(get("/api/suggest").param("word", ""))
                .andExpect(status().isBadRequest());
    }

    @Test
    void checkTextListsMisspellings() throws Exception {
        mvc.perform(post("/api/check").contentType(MediaType.TEXT_PLAIN).content("teh cat\ncaar"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].word").value("teh"))
                .andExpect(jsonPath("$[0].line").value(1))
                .andExpect(jsonPath("$[1].word").value("caar"))
                .andExpect(jsonPath("$[1].line").value(2))
                .andExpect(jsonPath("$[1].column").value(1))
                .andExpect(jsonPath("$[1].suggestions[0]").value("car"));
    }

    @Test
    void suggestReturnsScores() throws Exception {
        mvc.perform(get("/api/suggest").param("word", "teh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].text").value("the"))
                .andExpect(jsonPath("$[0].frequency").value(100))
                .andExpect(jsonPath("$[0].score").isNumber());
    }

    @Test
    void editDistanceSuggestions() throws Exception {
        mvc.perform(get("/api/suggest/edit-distance").param("word", "cax").param("maxDistance", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", contains("car", "cat")));
        mvc.perform(get("/api/suggest/edit-distance").param("word", "cax").param("maxDistance", "-1"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void prefixOrderedByFrequency() throws Exception {
        mvc.perform(get("/api/prefix").param("prefix", "ca"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", contains("car", "cat", "cats")));
    }

    @Test
    void phoneticLookup() throws Exception {
        mvc.perform(get("/api/phonetic").param("word", "Teh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("T000"))
                .andExpect(jsonPath("$.matches", contains("the")));
    }

    @Test
    void addThenRemoveWord() throws Exception {
        mvc.perform(post("/api/words").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"word\":\"zyx\",\"frequency\":3}"))
                .andExpect(status().isCreated());
        mvc.perform(get("/api/check").param("word", "zyx"))
                .andExpect(jsonPath("$.correct").value(true));

        mvc.perform(delete("/api/words/zyx"))
                .andExpect(status().isNoContent());
        mvc.perform(delete("/api/words/zyx"))
                .andExpect(status().isNotFound());
    }

    @Test
    void addWordValidatesBody() throws Exception {
        mvc.perform(post("/api/words").contentType(MediaType.APPLICATION_JSON).content("{\"word\":\"\"}"))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/api/words").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"word\":\"abc\",\"frequency\":-2}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void statsReportIndexSize() throws Exception {
        mvc.perform(get("/api/check").param("word", "teh"));

        mvc.perform(get("/api/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.wordCount").value(4))
                .andExpect(jsonPath("$.approximateMemoryBytes").isNumber())
                .andExpect(jsonPath("$.misspelledChecks").value(1.0));
    }

    @Test
    void addWordWithColonIsBadRequest() throws Exception {
        mvc.perform(post("/api/words").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"word\":\"re:send\",\"frequency\":2}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("bad_request"));
        mvc.perform(get("/api/stats"))
                .andExpect(jsonPath("$.wordCount").value(4));
    }

    @Test
    void loadMalformedDictionaryReportsOnlyEntryNumber() throws Exception {
        Files.writeString(dictionaryDir.resolve("bad.dict"), "secret:x:0\n", StandardCharsets.UTF_8);

        mvc.perform(post("/api/dictionary/load").param("path", "bad.dict"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("malformed_dictionary"))
                .andExpect(jsonPath("$.message").value("Malformed dictionary entry #1"))
                .andExpect(jsonPath("$.entry").value(1))
                .andExpect(content().string(not(containsString("secret"))));
    }

    @Test
    void pathsOutsideDictionaryDirectoryAreRejected() throws Exception {
        Path victim = workDir.resolve("important.txt");
        Files.writeString(victim, "important data", StandardCharsets.UTF_8);

        mvc.perform(post("/api/dictionary/save").param("path", victim.toString()))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/api/dictionary/save").param("path", "../important.txt"))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/api/dictionary/load").param("path", "/etc/passwd"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("bad_request"));
        mvc.perform(post("/api/dictionary/load").param("path", "."))
                .andExpect(status().isBadRequest());

        assertEquals("important data", Files.readString(victim, StandardCharsets.UTF_8));
        mvc.perform(get("/api/stats"))
                .andExpect(jsonPath("$.wordCount").value(4));
    }

    @Test
    void saveAndLoadDictionaryFiles() throws Exception {
        Files.createDirectory(dictionaryDir.resolve("sub"));

        mvc.perform(post("/api/dictionary/save").param("path", "words.dict"))
                .andExpect(status().isOk());
        assertTrue(Files.exists(dictionaryDir.resolve("words.dict")));
        mvc.perform(post("/api/dictionary/load").param("path", "words.dict"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.wordCount").value(4));
        mvc.perform(post("/api/dictionary/load").param("path", "missing.dict"))
                .andExpect(status().isNotFound());
        mvc.perform(post("/api/dictionary/save").param("path", "sub"))
                .andExpect(status().isInternalServerError());
    }
}
