package com.purchasingpower.fullcycle.workflow.agents;

import com.purchasingpower.fullcycle.exception.LlmException;
import com.purchasingpower.fullcycle.exception.NoChangesAppliedException;
import com.purchasingpower.fullcycle.model.ChangeType;
import com.purchasingpower.fullcycle.model.FileChange;
import com.purchasingpower.fullcycle.model.PipelineConfig;
import com.purchasingpower.fullcycle.model.PlannedChange;
import com.purchasingpower.fullcycle.support.FakeLlmClient;
import com.purchasingpower.fullcycle.support.FakeVersionControlDriver;
import com.purchasingpower.fullcycle.support.RecordingListener;
import com.purchasingpower.fullcycle.support.TestFixtures;
import com.purchasingpower.fullcycle.workflow.pipeline.RunContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.purchasingpower.fullcycle.support.TestFixtures.fenced;
import static com.purchasingpower.fullcycle.support.TestFixtures.lines;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Change Applier Tests")
class ChangeApplierTest {

    private static final String CLIENT = "src/main/java/com/acme/HttpClientWrapper.java";

    @TempDir
    Path root;

    private FakeLlmClient llm;
    private ChangeApplier applier;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        llm = new FakeLlmClient();
        applier = new ChangeApplier(TestFixtures.llmService(llm));
        listener = new RecordingListener();
    }

    @Test
    @DisplayName("Should accept a rewrite that shrinks a small file")
    void testApply_ShouldAcceptModestShrink() throws IOException {
        // Given
        TestFixtures.write(root, CLIENT, lines(10));
        llm.enqueue(fenced(lines(8)));
        RunContext ctx = context(modify(CLIENT));

        // When
        List<FileChange> applied = applier.apply(ctx);

        // Then
        assertEquals(List.of(new FileChange(CLIENT, 0, 2, false)), applied);
        assertEquals(lines(8), Files.readString(root.resolve(CLIENT)));
        assertEquals(applied, ctx.getChangedFiles());
    }

    @Test
    @DisplayName("Should reject a rewrite that truncates a large file and leave it untouched")
    void testApply_ShouldRejectTruncatedRewrite() throws IOException {
        // Given
        TestFixtures.write(root, CLIENT, lines(100));
        byte[] before = Files.readAllBytes(root.resolve(CLIENT));
        llm.enqueue(fenced(lines(20)));
        RunContext ctx = context(modify(CLIENT));

        // When
        NoChangesAppliedException thrown = assertThrows(NoChangesAppliedException.class, () -> applier.apply(ctx));

        // Then
        assertTrue(thrown.getMessage().startsWith("No changes applied"));
        assertArrayEquals(before, Files.readAllBytes(root.resolve(CLIENT)));
        assertTrue(ctx.getChangedFiles().isEmpty());
        assertTrue(ctx.getWarnings().stream().anyMatch(w -> w.contains("shrank from 100 to 20 lines")));
    }

    @Test
    @DisplayName("Should create missing files and remember them as new")
    void testApply_ShouldCreateFile() throws IOException {
        // Given
        String path = "src/main/java/com/acme/RetryPolicy.java";
        llm.enqueue("Here you go:\n" + fenced("class RetryPolicy {\n}\n"));
        RunContext ctx = context(PlannedChange.builder().filePath(path).changeType(ChangeType.CREATE).build());

        // When
        List<FileChange> applied = applier.apply(ctx);

        // Then
        assertEquals(List.of(new FileChange(path, 2, 0, true)), applied);
        assertEquals("class RetryPolicy {\n}\n", Files.readString(root.resolve(path)));
        assertEquals(List.of(path), List.copyOf(ctx.getCreatedPaths()));
        assertTrue(ctx.getTrackedTouchedPaths().isEmpty());
    }

    @Test
    @DisplayName("Should delete files without asking the LLM")
    void testApply_ShouldDeleteFile() {
        // Given
        TestFixtures.write(root, "legacy/Old.java", lines(3));
        RunContext ctx = context(PlannedChange.builder().filePath("legacy/Old.java").changeType(ChangeType.DELETE).build());

        // When
        List<FileChange> applied = applier.apply(ctx);

        // Then
        assertEquals(List.of(new FileChange("legacy/Old.java", 0, 3, false)), applied);
        assertFalse(Files.exists(root.resolve("legacy/Old.java")));
        assertEquals(0, llm.callCount());
    }

    @Test
    @DisplayName("Should never write or delete protected paths")
    void testApply_ShouldSkipProtectedPaths() {
        // Given
        TestFixtures.write(root, ".env", "TOKEN=secret\n");
        TestFixtures.write(root, CLIENT, lines(5));
        llm.enqueue(fenced(lines(6)));
        RunContext ctx = context(
                PlannedChange.builder().filePath(".env").changeType(ChangeType.DELETE).build(),
                modify(CLIENT));

        // When
        List<FileChange> applied = applier.apply(ctx);

        // Then
        assertTrue(Files.exists(root.resolve(".env")));
        assertEquals(1, applied.size());
        assertEquals(CLIENT, applied.get(0).path());
        assertTrue(listener.progress.contains("🔒 Skipping protected path .env"));
        assertEquals(1, llm.callCount());
    }

    @Test
    @DisplayName("Should skip an entry whose LLM call fails and continue with the rest")
    void testApply_ShouldContinueAfterLlmError() {
        // Given
        TestFixtures.write(root, "A.java", lines(3));
        TestFixtures.write(root, "B.java", lines(3));
        llm.enqueueError(new LlmException("Anthropic API Error: 500"))
                .enqueue(fenced(lines(4)));
        RunContext ctx = context(modify("A.java"), modify("B.java"));

        // When
        List<FileChange> applied = applier.apply(ctx);

        // Then
        assertEquals(List.of(new FileChange("B.java", 1, 0, false)), applied);
        assertTrue(ctx.getWarnings().stream().anyMatch(w -> w.contains("A.java")));
    }

    @Test
    @DisplayName("Should report an unchanged rewrite without recording a change")
    void testRewrite_Unchanged() {
        // Given
        TestFixtures.write(root, "A.java", lines(3));
        llm.enqueue(fenced(lines(3)));
        RunContext ctx = context();

        // When
        RewriteOutcome outcome = applier.rewrite(ctx, "A.java", "review-fix", Map.of("issues", "none"));

        // Then
        assertEquals(RewriteOutcome.Status.UNCHANGED, outcome.status());
        assertTrue(ctx.getChangedFiles().isEmpty());
    }

    @Test
    @DisplayName("Should not wipe a small file when the LLM returns an empty code block")
    void testRewrite_ShouldRejectBlankAnswer() throws IOException {
        // Given
        TestFixtures.write(root, "src/A.java", lines(30));
        byte[] before = Files.readAllBytes(root.resolve("src/A.java"));
        llm.enqueue("```java\n```");
        RunContext ctx = context();

        // When
        RewriteOutcome outcome = applier.rewrite(ctx, "src/A.java", "review-fix", Map.of("issues", "x"));

        // Then
        assertEquals(RewriteOutcome.Status.REJECTED_EMPTY, outcome.status());
        assertFalse(outcome.isWritten());
        assertArrayEquals(before, Files.readAllBytes(root.resolve("src/A.java")));
        assertTrue(ctx.getChangedFiles().isEmpty());
        assertTrue(ctx.getWarnings().contains("Rewrite of src/A.java rejected: the LLM returned no content"));
    }

    @Test
    @DisplayName("Should skip rewrites of missing files without calling the LLM")
    void testRewrite_MissingFile() {
        // When
        RewriteOutcome outcome = applier.rewrite(context(), "Nope.java", "compile-fix", Map.of("errors", "x"));

        // Then
        assertEquals(RewriteOutcome.Status.SKIPPED_MISSING, outcome.status());
        assertEquals(0, llm.callCount());
    }

    @Test
    @DisplayName("Should apply the guard thresholds exactly")
    void testIsTruncated_Boundaries() {
        assertFalse(ChangeApplier.isTruncated(50, 1));
        assertTrue(ChangeApplier.isTruncated(51, 25));
        assertFalse(ChangeApplier.isTruncated(51, 26));
        assertFalse(ChangeApplier.isTruncated(100, 50));
        assertTrue(ChangeApplier.isTruncated(100, 49));
    }

    @Test
    @DisplayName("Should map compiler paths into the project")
    void testToProjectPath() {
        Path absolute = root.toAbsolutePath().resolve("src/A.java");

        assertEquals(Optional.of("src/A.java"), ChangeApplier.toProjectPath(root, absolute.toString()));
        assertEquals(Optional.of("src/A.java"), ChangeApplier.toProjectPath(root, "./src/A.java"));
        assertEquals(Optional.empty(), ChangeApplier.toProjectPath(root, "/elsewhere/B.java"));
        assertEquals(Optional.empty(), ChangeApplier.toProjectPath(root, null));
    }

    private RunContext context(PlannedChange... changes) {
        return TestFixtures.context(root, PipelineConfig.defaults(), new FakeVersionControlDriver(), listener, changes);
    }

    private static PlannedChange modify(String path) {
        return PlannedChange.builder().filePath(path).changeType(ChangeType.MODIFY).description("add retry").build();
    }
}
