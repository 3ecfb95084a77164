package com.purchasingpower.fullcycle.support;

import com.purchasingpower.fullcycle.config.LlmProperties;
import com.purchasingpower.fullcycle.model.ExecutionPlan;
import com.purchasingpower.fullcycle.model.PipelineConfig;
import com.purchasingpower.fullcycle.model.PlannedChange;
import com.purchasingpower.fullcycle.model.RepositoryCoordinates;
import com.purchasingpower.fullcycle.service.LlmService;
import com.purchasingpower.fullcycle.service.PromptLibraryService;
import com.purchasingpower.fullcycle.workflow.pipeline.RunContext;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Shared builders for unit tests.
 */
public final class TestFixtures {

    public static final RepositoryCoordinates REPO = new RepositoryCoordinates("acme", "widgets");

    private TestFixtures() {
    }

    /**
     * LlmService over the real prompt templates, with a no-op sleeper.
     */
    public static LlmService llmService(FakeLlmClient client) {
        PromptLibraryService prompts = new PromptLibraryService();
        prompts.loadPrompts();
        return new LlmService(client, prompts, new LlmProperties(), duration -> {
        });
    }

    public static RunContext context(Path root, PipelineConfig config, FakeVersionControlDriver vcs,
                                     RecordingListener listener, PlannedChange... changes) {
        RunContext ctx = new RunContext("Add retry to the HTTP client", root, config, listener);
        ctx.setVcs(vcs);
        ctx.setRepository(REPO);
        ctx.setBranchName("feature/ai-1700000000-add-retry-to");
        ctx.setPlan(new ExecutionPlan("Add retry to the HTTP client", List.of(changes), changes.length, "Add retry"));
        return ctx;
    }

    /**
     * Text of {@code count} numbered lines, each ending with a newline.
     */
    public static String lines(int count) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(i -> "line " + i)
                .collect(Collectors.joining("\n", "", "\n"));
    }

    public static String fenced(String content) {
        return "```java\n" + content + "```";
    }

    public static Path write(Path root, String relative, String content) {
        try {
            Path file = root.resolve(relative);
            Files.createDirectories(file.getParent());
            Files.writeString(file, content);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
