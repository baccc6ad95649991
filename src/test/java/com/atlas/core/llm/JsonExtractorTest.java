package com.atlas.core.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonExtractorTest {

    @Test
    @DisplayName("extracts an object wrapped in prose and markdown fences")
    void extractsWrappedObject() {
        String text = "Here is the plan:\n```json\n{\"a\": {\"b\": 1}}\n```\nLet me know!";
        assertEquals(Optional.of("{\"a\": {\"b\": 1}}"), JsonExtractor.extractObject(text));
    }

    @Test
    @DisplayName("span is greedy from first open brace to last close brace")
    void greedySpan() {
        assertEquals("{1} and {2}", JsonExtractor.extractObject("x {1} and {2} y").orElseThrow());
    }

    @Test
    @DisplayName("no braces, null and blank yield empty")
    void noObject() {
        assertTrue(JsonExtractor.extractObject("I cannot help with that").isEmpty());
        assertTrue(JsonExtractor.extractObject(null).isEmpty());
        assertTrue(JsonExtractor.extractObject("  ").isEmpty());
    }
}
