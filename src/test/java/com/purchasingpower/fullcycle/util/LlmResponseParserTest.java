package com.purchasingpower.fullcycle.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LLM Response Parser Tests")
class LlmResponseParserTest {

    @Test
    @DisplayName("Should extract the plan object from a chatty fenced answer")
    void testExtractJsonObject_ShouldSkipPreambleAndFences() throws IOException {
        // Given
        String response = fixture("plan-with-preamble.txt");

        // When
        Optional<String> json = LlmResponseParser.extractJsonObject(response);

        // Then
        assertTrue(json.isPresent());
        assertTrue(json.get().startsWith("{"));
        assertTrue(json.get().endsWith("}"));
        assertTrue(json.get().contains("RetryPolicy.java"));
        assertFalse(json.get().contains("Let me know"));
    }

    @Test
    @DisplayName("Should ignore braces inside JSON strings")
    void testExtractJsonObject_ShouldIgnoreBracesInStrings() {
        // Given
        String response = "result: {\"a\": \"text with } brace\", \"b\": {\"c\": 1}} trailing }";

        // When
        Optional<String> json = LlmResponseParser.extractJsonObject(response);

        // Then
        assertEquals("{\"a\": \"text with } brace\", \"b\": {\"c\": 1}}", json.orElseThrow());
    }

    @Test
    @DisplayName("Should return empty when no object is complete")
    void testExtractJsonObject_ShouldReturnEmptyForUnbalancedText() {
        assertTrue(LlmResponseParser.extractJsonObject("{\"a\": 1").isEmpty());
        assertTrue(LlmResponseParser.extractJsonObject("no json here").isEmpty());
        assertTrue(LlmResponseParser.extractJsonObject(null).isEmpty());
    }

    @Test
    @DisplayName("Should strip preamble and explanation around a fenced file")
    void testCleanCode_ShouldKeepOnlyFencedContent() throws IOException {
        // Given
        String response = fixture("code-with-preamble.txt");

        // When
        String code = LlmResponseParser.cleanCode(response);

        // Then
        assertTrue(code.startsWith("package com.acme;"));
        assertTrue(code.endsWith("}\n"));
        assertFalse(code.contains("Here is"));
        assertFalse(code.contains("exclamation"));
        assertEquals(7, LlmResponseParser.countLines(code));
    }

    @Test
    @DisplayName("Should drop a dangling opening fence")
    void testCleanCode_ShouldHandleUnterminatedFence() throws IOException {
        // Given
        String response = fixture("code-unterminated-fence.txt");

        // When
        String code = LlmResponseParser.cleanCode(response);

        // Then
        assertEquals("fun main() {\n    println(\"hi\")\n}\n", code);
    }

    @Test
    @DisplayName("Should pick the largest block when the answer has several")
    void testCleanCode_ShouldPreferLargestBlock() throws IOException {
        // Given
        String response = fixture("code-two-blocks.txt");

        // When
        String code = LlmResponseParser.cleanCode(response);

        // Then
        assertTrue(code.startsWith("package com.acme;"));
        assertTrue(code.contains("public RetryPolicy(Duration delay)"));
    }

    @Test
    @DisplayName("Should strip a stray heading before unfenced code")
    void testCleanCode_ShouldStripHeading() {
        // Given
        String response = "## Updated file\n\nclass A {}\n\n\n";

        // When
        String code = LlmResponseParser.cleanCode(response);

        // Then
        assertEquals("class A {}\n", code);
    }

    @Test
    @DisplayName("Should count lines like an editor")
    void testCountLines() {
        assertEquals(0, LlmResponseParser.countLines(""));
        assertEquals(1, LlmResponseParser.countLines("a"));
        assertEquals(2, LlmResponseParser.countLines("a\nb\n"));
    }

    private String fixture(String name) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/llm-responses/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
