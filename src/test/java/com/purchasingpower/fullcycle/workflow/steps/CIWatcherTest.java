package com.purchasingpower.fullcycle.workflow.steps;

import com.purchasingpower.fullcycle.model.ChangeType;
import com.purchasingpower.fullcycle.model.FileChange;
import com.purchasingpower.fullcycle.model.PipelineConfig;
import com.purchasingpower.fullcycle.model.PlannedChange;
import com.purchasingpower.fullcycle.service.ProjectFileScanner;
import com.purchasingpower.fullcycle.support.FakeCommandRunner;
import com.purchasingpower.fullcycle.support.FakeLlmClient;
import com.purchasingpower.fullcycle.support.FakePullRequestGateway;
import com.purchasingpower.fullcycle.support.FakeVersionControlDriver;
import com.purchasingpower.fullcycle.support.RecordingListener;
import com.purchasingpower.fullcycle.support.TestFixtures;
import com.purchasingpower.fullcycle.workflow.agents.ChangeApplier;
import com.purchasingpower.fullcycle.workflow.agents.CiFailureAnalyzer;
import com.purchasingpower.fullcycle.workflow.pipeline.RunContext;
import com.purchasingpower.fullcycle.workflow.state.CIResult;
import com.purchasingpower.fullcycle.workflow.state.CiStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.purchasingpower.fullcycle.support.TestFixtures.fenced;
import static com.purchasingpower.fullcycle.support.TestFixtures.lines;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CI Watcher Tests")
class CIWatcherTest {

    private static final String CLIENT = "src/main/java/com/acme/HttpClientWrapper.java";
    private static final String CI_LOG = """
            2024-05-01T10:00:00.0000000Z [INFO] Compiling 12 source files
            2024-05-01T10:00:01.0000000Z [ERROR] /home/runner/work/widgets/widgets/%s:[3,1] cannot find symbol
            2024-05-01T10:00:01.0000000Z [INFO] BUILD FAILURE
            """.formatted(CLIENT);

    @TempDir
    Path root;

    private FakeLlmClient llm;
    private FakePullRequestGateway gateway;
    private FakeVersionControlDriver vcs;
    private FakeCommandRunner runner;
    private RecordingListener listener;
    private List<Duration> sleeps;
    private CIWatcher watcher;

    private final PipelineConfig config = PipelineConfig.builder()
            .maxCIRetries(3)
            .ciPollInterval(Duration.ofSeconds(1))
            .ciWaitWindow(Duration.ofSeconds(3))
            .build();

    @BeforeEach
    void setUp() {
        llm = new FakeLlmClient();
        AtomicInteger size = new AtomicInteger(10);
        llm.respondWith(request -> fenced(lines(size.incrementAndGet())));
        gateway = new FakePullRequestGateway();
        vcs = new FakeVersionControlDriver();
        runner = new FakeCommandRunner();
        listener = new RecordingListener();
        sleeps = new ArrayList<>();

        ProjectFileScanner scanner = new ProjectFileScanner();
        ChangeApplier applier = new ChangeApplier(TestFixtures.llmService(llm));
        watcher = new CIWatcher(gateway, new CiFailureAnalyzer(scanner), applier,
                new LocalValidator(runner, applier, scanner), sleeps::add);
        TestFixtures.write(root, CLIENT, lines(10));
    }

    @Test
    @DisplayName("Should fail after the retry budget when CI keeps failing")
    void testWatch_ShouldFailAfterMaxRetries() {
        // Given
        gateway.ciStatuses.add(failed());
        gateway.failedRunId = 7L;
        gateway.runLogs = CI_LOG;
        RunContext ctx = context(config);

        // When
        CiOutcome outcome = watcher.watch(ctx);

        // Then
        assertFalse(outcome.passed());
        assertEquals(3, outcome.fixAttempts());
        assertEquals("CI failed after 3 attempts", outcome.failureReason());
        assertEquals(3, ctx.getCiRuns());
        assertEquals(List.of(
                "fix: resolve CI failure (attempt 1)",
                "fix: resolve CI failure (attempt 2)",
                "fix: resolve CI failure (attempt 3)"), vcs.commits);
        assertTrue(FakeLlmClient.userPrompt(llm.getRequests().get(0)).contains("cannot find symbol"));
        assertEquals(List.of("WaitingForCI", "FixingCIError", "WaitingForCI", "FixingCIError",
                "WaitingForCI", "FixingCIError"), listener.stateNames());
    }

    @Test
    @DisplayName("Should keep polling until CI succeeds")
    void testWatch_ShouldPassAfterPolling() {
        // Given
        gateway.ciStatuses.add(CIResult.pending());
        gateway.ciStatuses.add(CIResult.of(CiStatus.RUNNING));
        gateway.ciStatuses.add(CIResult.of(CiStatus.SUCCESS));
        RunContext ctx = context(config);

        // When
        CiOutcome outcome = watcher.watch(ctx);

        // Then
        assertTrue(outcome.passed());
        assertEquals(0, outcome.fixAttempts());
        assertEquals(3, gateway.ciPolls);
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(1)), sleeps);
    }

    @Test
    @DisplayName("Should give up when CI does not finish within the wait window")
    void testWatch_ShouldFailWhenWindowCloses() {
        // Given
        RunContext ctx = context(config);

        // When
        CiOutcome outcome = watcher.watch(ctx);

        // Then
        assertFalse(outcome.passed());
        assertEquals("CI did not finish within 3 seconds (PR #42 left open)", outcome.failureReason());
        assertEquals(3, gateway.ciPolls);
        assertEquals(2, sleeps.size());
    }

    @Test
    @DisplayName("Should stop on a cancelled run")
    void testWatch_ShouldFailWhenCancelled() {
        // Given
        gateway.ciStatuses.add(CIResult.of(CiStatus.CANCELLED));
        RunContext ctx = context(config);

        // When
        CiOutcome outcome = watcher.watch(ctx);

        // Then
        assertFalse(outcome.passed());
        assertEquals("CI run was cancelled", outcome.failureReason());
        assertTrue(ctx.getErrors().contains("CI run was cancelled"));
        assertTrue(vcs.commits.isEmpty());
    }

    @Test
    @DisplayName("Should rebuild locally when CI logs are unavailable")
    void testWatch_ShouldFallBackToLocalBuildLogs() {
        // Given
        gateway.ciStatuses.add(failed());
        gateway.ciStatuses.add(CIResult.of(CiStatus.SUCCESS));
        runner.thenFail("[ERROR] " + CLIENT + ":[3,1] cannot find symbol");
        RunContext ctx = context(PipelineConfig.builder()
                .buildCommand(List.of("mvn", "compile"))
                .ciPollInterval(Duration.ZERO)
                .build());

        // When
        CiOutcome outcome = watcher.watch(ctx);

        // Then
        assertTrue(outcome.passed());
        assertEquals(1, outcome.fixAttempts());
        assertEquals(List.of(List.of("mvn", "compile")), runner.invocations);
        assertEquals(List.of("fix: resolve CI failure (attempt 1)"), vcs.commits);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Should record an error when no fix can be applied and wait again")
    void testWatch_ShouldRecordUnfixableFailure() {
        // Given
        gateway.ciStatuses.add(failed());
        gateway.ciStatuses.add(CIResult.of(CiStatus.SUCCESS));
        RunContext ctx = TestFixtures.context(root, PipelineConfig.builder().ciPollInterval(Duration.ZERO).build(),
                vcs, listener);
        ctx.setPullRequest(gateway.nextPullRequest);

        // When
        CiOutcome outcome = watcher.watch(ctx);

        // Then
        assertTrue(outcome.passed());
        assertEquals(List.of("CI error: Check 'build' concluded failure"), ctx.getErrors());
        assertEquals(0, llm.callCount());
    }

    private RunContext context(PipelineConfig pipelineConfig) {
        RunContext ctx = TestFixtures.context(root, pipelineConfig, vcs, listener,
                PlannedChange.builder().filePath(CLIENT).changeType(ChangeType.MODIFY).build());
        ctx.recordChange(new FileChange(CLIENT, 2, 0, false));
        ctx.setPullRequest(gateway.nextPullRequest);
        return ctx;
    }

    private static CIResult failed() {
        return CIResult.builder()
                .status(CiStatus.FAILED)
                .checkName("build")
                .errorMessage("Check 'build' concluded failure")
                .build();
    }
}
