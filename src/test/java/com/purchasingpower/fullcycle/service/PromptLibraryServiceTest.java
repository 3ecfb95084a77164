package com.purchasingpower.fullcycle.service;

import com.purchasingpower.fullcycle.client.LlmRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Prompt Library Service Tests")
class PromptLibraryServiceTest {

    private PromptLibraryService promptLibrary;

    @BeforeEach
    void setUp() {
        promptLibrary = new PromptLibraryService();
        promptLibrary.loadPrompts();
    }

    @Test
    @DisplayName("Should load every template the pipeline uses")
    void testLoadPrompts_ShouldLoadAllTemplates() {
        for (String name : new String[]{"task-planner", "file-create", "file-modify", "review-fix",
                "compile-fix", "test-fix", "ci-fix", "code-review"}) {
            assertNotNull(promptLibrary.getTemplate(name), "missing template " + name);
            assertNotNull(promptLibrary.getTemplate(name).getUserPrompt(), "empty user prompt in " + name);
        }
    }

    @Test
    @DisplayName("Should not HTML-escape source code")
    void testRender_ShouldKeepCodeVerbatim() {
        // Given
        String code = "if (a < b && c > d) { return \"x\"; }";

        // When
        String prompt = promptLibrary.render("file-modify", Map.of(
                "task", "Fix comparison",
                "filePath", "src/A.java",
                "content", code,
                "context", "",
                "description", "flip the check"));

        // Then
        assertTrue(prompt.contains(code));
        assertFalse(prompt.contains("&lt;"));
    }

    @Test
    @DisplayName("Should carry system prompt and sampling settings into the request")
    void testRenderRequest() {
        // When
        LlmRequest request = promptLibrary.renderRequest("code-review", "CodeReviewAgent",
                Map.of("task", "Add retry", "diff", "diff --git a/A.java b/A.java"));

        // Then
        assertEquals("CodeReviewAgent", request.getCaller());
        assertFalse(request.getSystemPrompt().isBlank());
        assertEquals(1, request.getMessages().size());
        assertTrue(request.getMessages().get(0).content().contains("diff --git a/A.java b/A.java"));
    }

    @Test
    @DisplayName("Should reject unknown template names")
    void testRender_UnknownTemplate() {
        assertThrows(IllegalArgumentException.class, () -> promptLibrary.render("no-such-template", Map.of()));
    }
}
