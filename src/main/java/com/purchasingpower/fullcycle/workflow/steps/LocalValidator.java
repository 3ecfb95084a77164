package com.purchasingpower.fullcycle.workflow.steps;

import com.purchasingpower.fullcycle.exception.CompilationFailedException;
import com.purchasingpower.fullcycle.model.CommandResult;
import com.purchasingpower.fullcycle.model.PipelineConfig;
import com.purchasingpower.fullcycle.service.BuildTool;
import com.purchasingpower.fullcycle.service.CommandRunner;
import com.purchasingpower.fullcycle.service.ProjectFileScanner;
import com.purchasingpower.fullcycle.util.CompilerOutputParser;
import com.purchasingpower.fullcycle.workflow.agents.ChangeApplier;
import com.purchasingpower.fullcycle.workflow.agents.RewriteOutcome;
import com.purchasingpower.fullcycle.workflow.pipeline.RunContext;
import com.purchasingpower.fullcycle.workflow.state.BuildResult;
import com.purchasingpower.fullcycle.workflow.state.CompilationError;
import com.purchasingpower.fullcycle.workflow.state.PipelineState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds and tests the working tree, letting the LLM fix what breaks.
 *
 * <p>Compilation is mandatory: when the build still fails after
 * {@code maxCompilationAttempts} builds, the run's changes are reverted and
 * {@link CompilationFailedException} is thrown. Failing tests only produce a warning.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocalValidator {

    static final int LOG_TAIL_CHARS = 4_000;

    private final CommandRunner commandRunner;
    private final ChangeApplier changeApplier;
    private final ProjectFileScanner fileScanner;

    public void validate(RunContext ctx) {
        compile(ctx);
        if (ctx.getConfig().isRunLocalTests()) {
            runTests(ctx);
        } else {
            ctx.progress("⏭️ Local tests disabled");
        }
    }

    /**
     * Compile loop.
     *
     * @throws CompilationFailedException when the fix budget is spent; the working tree is reverted first
     */
    public BuildResult compile(RunContext ctx) {
        Optional<List<String>> command = buildCommand(ctx);
        if (command.isEmpty()) {
            ctx.progress("⏭️ No build tool detected, skipping local validation");
            return BuildResult.skipped();
        }

        int maxAttempts = ctx.getConfig().getMaxCompilationAttempts();
        BuildResult result = null;
        int builds = 0;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            builds = attempt;
            ctx.transition(new PipelineState.ValidatingLocally("compile", attempt));
            ctx.progress(String.format("🔨 Building (attempt %d/%d)...", attempt, maxAttempts));
            result = run(ctx, command.get());
            if (result.isSuccess()) {
                ctx.progress("✅ Build passed");
                return result;
            }

            log.warn("❌ Build failed with {} errors", result.getCompilationErrors().size());
            if (attempt == maxAttempts || !fixCompilationErrors(ctx, result)) {
                break;
            }
        }

        ctx.progress("❌ Build still failing, reverting changes");
        ctx.getVcs().revert(ctx.getTrackedTouchedPaths(), ctx.getCreatedPaths());
        throw new CompilationFailedException(
                "Compilation failed after " + builds + " attempts; changes were reverted",
                result.logTail(LOG_TAIL_CHARS));
    }

    /**
     * Test loop; exhaustion is recorded as a warning on the run.
     */
    public BuildResult runTests(RunContext ctx) {
        Optional<List<String>> command = testCommand(ctx);
        if (command.isEmpty()) {
            return BuildResult.skipped();
        }

        int maxAttempts = ctx.getConfig().getMaxTestAttempts();
        BuildResult result = null;
        int runs = 0;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            runs = attempt;
            ctx.transition(new PipelineState.ValidatingLocally("test", attempt));
            ctx.progress(String.format("🧪 Running tests (attempt %d/%d)...", attempt, maxAttempts));
            result = run(ctx, command.get());
            if (result.isSuccess()) {
                ctx.progress("✅ Tests passed");
                return result;
            }

            log.warn("❌ Tests failed: {}", result.getFailedTests());
            if (attempt == maxAttempts || !fixTestFailures(ctx, result)) {
                break;
            }
        }

        ctx.warn("Local tests still failing after " + runs + " attempts"
                + (result.getFailedTests().isEmpty() ? "" : ": " + String.join(", ", result.getFailedTests())));
        return result;
    }

    /**
     * One build with the run's build command, for callers that only need the signal.
     */
    public Optional<BuildResult> buildOnce(RunContext ctx) {
        return buildCommand(ctx).map(command -> run(ctx, command));
    }

    private boolean fixCompilationErrors(RunContext ctx, BuildResult result) {
        Map<String, List<CompilationError>> byFile = new LinkedHashMap<>();
        for (CompilationError error : result.getCompilationErrors()) {
            ChangeApplier.toProjectPath(ctx.getProjectRoot(), error.getFile())
                    .ifPresent(path -> byFile.computeIfAbsent(path, k -> new ArrayList<>()).add(error));
        }
        if (byFile.isEmpty()) {
            log.warn("⚠️ No file-level errors found in build output, nothing to fix");
            return false;
        }

        boolean anyWritten = false;
        for (Map.Entry<String, List<CompilationError>> entry : byFile.entrySet()) {
            String errors = entry.getValue().stream().map(CompilationError::format).collect(Collectors.joining("\n"));
            ctx.progress("🔧 Fixing " + entry.getValue().size() + " compilation errors in " + entry.getKey());
            RewriteOutcome outcome = changeApplier.rewrite(ctx, entry.getKey(), "compile-fix", Map.of("errors", errors));
            anyWritten |= outcome.isWritten();
        }
        return anyWritten;
    }

    private boolean fixTestFailures(RunContext ctx, BuildResult result) {
        Set<String> files = new LinkedHashSet<>();
        for (String testClass : result.getFailedTests()) {
            fileScanner.findClassSource(ctx.getProjectRoot(), testClass).ifPresent(files::add);
        }
        for (CompilationError error : result.getCompilationErrors()) {
            ChangeApplier.toProjectPath(ctx.getProjectRoot(), error.getFile()).ifPresent(files::add);
        }
        // Failing tests usually point at code the run changed
        files.addAll(ctx.getTouchedPaths());

        boolean anyWritten = false;
        String failures = String.join("\n", result.getFailedTests());
        String logTail = result.logTail(LOG_TAIL_CHARS);
        for (String file : files) {
            RewriteOutcome outcome = changeApplier.rewrite(ctx, file, "test-fix",
                    Map.of("failures", failures, "log", logTail));
            anyWritten |= outcome.isWritten();
        }
        return anyWritten;
    }

    private BuildResult run(RunContext ctx, List<String> command) {
        CommandResult commandResult = commandRunner.run(ctx.getProjectRoot(), command, ctx.getConfig().getCommandTimeout());
        String output = commandResult.output();
        BuildResult.BuildResultBuilder builder = BuildResult.builder()
                .success(commandResult.isSuccess())
                .buildLogs(output)
                .durationMs(commandResult.durationMs());
        if (!commandResult.isSuccess()) {
            builder.compilationErrors(CompilerOutputParser.parseCompilationErrors(output));
            builder.failedTests(CompilerOutputParser.parseFailedTests(output));
        }
        return builder.build();
    }

    private Optional<List<String>> buildCommand(RunContext ctx) {
        PipelineConfig config = ctx.getConfig();
        if (!config.getBuildCommand().isEmpty()) {
            return Optional.of(config.getBuildCommand());
        }
        Path root = ctx.getProjectRoot();
        return BuildTool.detect(root).map(tool -> tool.compileCommand(root));
    }

    private Optional<List<String>> testCommand(RunContext ctx) {
        PipelineConfig config = ctx.getConfig();
        if (!config.getTestCommand().isEmpty()) {
            return Optional.of(config.getTestCommand());
        }
        Path root = ctx.getProjectRoot();
        return BuildTool.detect(root).map(tool -> tool.testCommand(root));
    }
}
