package com.purchasingpower.fullcycle.workflow.agents;

import com.purchasingpower.fullcycle.exception.LlmException;
import com.purchasingpower.fullcycle.exception.NoChangesAppliedException;
import com.purchasingpower.fullcycle.exception.PipelineException;
import com.purchasingpower.fullcycle.exception.RateLimitException;
import com.purchasingpower.fullcycle.model.ExecutionPlan;
import com.purchasingpower.fullcycle.model.FileChange;
import com.purchasingpower.fullcycle.model.PlannedChange;
import com.purchasingpower.fullcycle.service.LlmService;
import com.purchasingpower.fullcycle.util.LlmResponseParser;
import com.purchasingpower.fullcycle.util.ProtectedPathMatcher;
import com.purchasingpower.fullcycle.workflow.pipeline.RunContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes file contents produced by the LLM into the working tree.
 *
 * <p>All LLM rewrites of existing files (plan entries, review fixes, local build fixes and CI
 * fixes) go through {@link #rewrite}, which applies the anti-truncation guard: a file of more
 * than {@value #GUARD_MIN_LINES} lines is never replaced by content less than half as long.
 * Protected paths are never written or deleted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChangeApplier {

    static final int GUARD_MIN_LINES = 50;
    static final double GUARD_MIN_RATIO = 0.5;
    static final int MAX_CONTENT_CHARS = 10_000;
    static final int MAX_CONTEXT_CHARS = 3_000;

    private final LlmService llmService;

    /**
     * Apply every entry of the run's plan in order.
     *
     * @return the changes that were actually made
     * @throws NoChangesAppliedException when no entry produced a change
     */
    public List<FileChange> apply(RunContext ctx) {
        ExecutionPlan plan = ctx.getPlan();
        List<FileChange> applied = new ArrayList<>();
        int index = 0;

        for (PlannedChange change : plan.getPlannedChanges()) {
            index++;
            String path = change.getFilePath();
            if (ctx.getProtectedPaths().isProtected(path)) {
                ctx.progress("🔒 Skipping protected path " + path);
                continue;
            }
            ctx.progress(String.format("✏️ [%d/%d] %s %s", index, plan.getPlannedChanges().size(),
                    change.getChangeType().getIcon(), path));

            try {
                Optional<FileChange> result = switch (change.getChangeType()) {
                    case CREATE, MODIFY -> write(ctx, change);
                    case DELETE -> delete(ctx, path);
                };
                result.ifPresent(applied::add);
            } catch (RateLimitException e) {
                throw e;
            } catch (LlmException e) {
                ctx.warn("Skipped " + path + ": " + e.getMessage());
            }
        }

        if (applied.isEmpty()) {
            throw new NoChangesAppliedException("No changes applied: every planned change was skipped or rejected");
        }
        log.info("✅ Applied {} of {} planned changes", applied.size(), plan.getPlannedChanges().size());
        return applied;
    }

    private Optional<FileChange> write(RunContext ctx, PlannedChange change) {
        String path = change.getFilePath();
        Path file = ctx.getProjectRoot().resolve(path);

        if (Files.isRegularFile(file)) {
            Map<String, Object> variables = new HashMap<>();
            variables.put("description", change.getDescription() == null ? "" : change.getDescription());
            RewriteOutcome outcome = rewrite(ctx, path, "file-modify", variables);
            return Optional.ofNullable(outcome.change());
        }

        // MODIFY of a missing file is treated as CREATE
        Map<String, Object> variables = baseVariables(ctx, path);
        variables.put("description", change.getDescription() == null ? "" : change.getDescription());
        String content = LlmResponseParser.cleanCode(llmService.complete("file-create", "ChangeApplier", variables));
        if (content.isBlank()) {
            ctx.warn("LLM returned no content for new file " + path);
            return Optional.empty();
        }

        writeFile(file, content);
        FileChange created = new FileChange(path, LlmResponseParser.countLines(content), 0, true);
        ctx.recordChange(created);
        return Optional.of(created);
    }

    private Optional<FileChange> delete(RunContext ctx, String path) {
        Path file = ctx.getProjectRoot().resolve(path);
        if (!Files.isRegularFile(file)) {
            ctx.warn("Cannot delete " + path + ": file does not exist");
            return Optional.empty();
        }
        try {
            int lines = LlmResponseParser.countLines(Files.readString(file, StandardCharsets.UTF_8));
            Files.delete(file);
            FileChange deleted = new FileChange(path, 0, lines, false);
            ctx.recordChange(deleted);
            return Optional.of(deleted);
        } catch (IOException e) {
            throw new PipelineException("Failed to delete " + path, e);
        }
    }

    /**
     * Ask the LLM for a new version of an existing file and write it if it passes the guard.
     *
     * <p>The template receives {@code task}, {@code filePath}, {@code content} and {@code context}
     * in addition to {@code variables}.
     */
    public RewriteOutcome rewrite(RunContext ctx, String path, String templateName, Map<String, Object> variables) {
        if (ctx.getProtectedPaths().isProtected(path)) {
            ctx.progress("🔒 Not touching protected path " + path);
            return RewriteOutcome.of(path, RewriteOutcome.Status.SKIPPED_PROTECTED);
        }
        Path file = ctx.getProjectRoot().resolve(path);
        if (!Files.isRegularFile(file)) {
            log.debug("Skipping rewrite of missing file {}", path);
            return RewriteOutcome.of(path, RewriteOutcome.Status.SKIPPED_MISSING);
        }

        String original = readFile(file);
        Map<String, Object> allVariables = baseVariables(ctx, path);
        allVariables.put("content", truncate(original, MAX_CONTENT_CHARS));
        allVariables.putAll(variables);

        String rewritten;
        try {
            rewritten = LlmResponseParser.cleanCode(llmService.complete(templateName, "ChangeApplier", allVariables));
        } catch (RateLimitException e) {
            throw e;
        } catch (LlmException e) {
            ctx.warn("Rewrite of " + path + " failed: " + e.getMessage());
            return RewriteOutcome.of(path, RewriteOutcome.Status.FAILED);
        }

        return applyGuarded(ctx, path, original, rewritten);
    }

    RewriteOutcome applyGuarded(RunContext ctx, String path, String original, String rewritten) {
        if (rewritten.isBlank()) {
            ctx.warn("Rewrite of " + path + " rejected: the LLM returned no content");
            return RewriteOutcome.of(path, RewriteOutcome.Status.REJECTED_EMPTY);
        }
        int oldLines = LlmResponseParser.countLines(original);
        int newLines = LlmResponseParser.countLines(rewritten);

        if (isTruncated(oldLines, newLines)) {
            ctx.warn(String.format("Rewrite of %s rejected: shrank from %d to %d lines", path, oldLines, newLines));
            return RewriteOutcome.of(path, RewriteOutcome.Status.REJECTED_TRUNCATED);
        }
        if (rewritten.equals(original)) {
            return RewriteOutcome.of(path, RewriteOutcome.Status.UNCHANGED);
        }

        writeFile(ctx.getProjectRoot().resolve(path), rewritten);
        FileChange change = new FileChange(path, Math.max(0, newLines - oldLines), Math.max(0, oldLines - newLines), false);
        ctx.recordChange(change);
        return new RewriteOutcome(path, RewriteOutcome.Status.WRITTEN, change);
    }

    /**
     * True when a file of more than 50 lines would shrink below half its size.
     */
    public static boolean isTruncated(int oldLines, int newLines) {
        return oldLines > GUARD_MIN_LINES && (double) newLines / oldLines < GUARD_MIN_RATIO;
    }

    /**
     * Map a file name reported by a compiler or reviewer to a path relative to the project root.
     *
     * @return empty when the file lies outside the project
     */
    public static Optional<String> toProjectPath(Path projectRoot, String reported) {
        if (reported == null || reported.isBlank()) {
            return Optional.empty();
        }
        String trimmed = reported.trim();
        Path candidate = Path.of(trimmed);
        if (candidate.isAbsolute()) {
            Path root = projectRoot.toAbsolutePath().normalize();
            Path normalized = candidate.normalize();
            if (!normalized.startsWith(root)) {
                return Optional.empty();
            }
            return Optional.of(ProtectedPathMatcher.normalize(root.relativize(normalized).toString()));
        }
        return Optional.of(ProtectedPathMatcher.normalize(trimmed));
    }

    private Map<String, Object> baseVariables(RunContext ctx, String path) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("task", ctx.getTaskDescription());
        variables.put("filePath", path);
        variables.put("context", truncate(ctx.getRetrievedContext(), MAX_CONTEXT_CHARS));
        return variables;
    }

    private static String readFile(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PipelineException("Failed to read " + file, e);
        }
    }

    private static void writeFile(Path file, String content) {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PipelineException("Failed to write " + file, e);
        }
    }

    private static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxChars ? text : text.substring(0, maxChars) + "\n... (truncated)";
    }
}
