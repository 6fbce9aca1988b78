package com.spellcheck.controller;

import com.spellcheck.data.DictionaryFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns domain errors into small JSON bodies: {@code {"error": ..., "message": ...}}.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(DictionaryFormatException.class)
    public ResponseEntity<Map<String, Object>> malformedDictionary(DictionaryFormatException ex) {
        // entry text is file content; keep it out of responses and logs
        log.warn("Rejected dictionary: malformed entry #{}", ex.getEntryNumber());
        Map<String, Object> body = body("malformed_dictionary", "Malformed dictionary entry #" + ex.getEntryNumber());
        body.put("entry", ex.getEntryNumber());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(body("bad_request", ex.getMessage()));
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<Map<String, Object>> io(UncheckedIOException ex) {
        log.warn("I/O failure: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body("io_error", ex.getMessage()));
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("error", error);
        m.put("message", message);
        return m;
    }
}
