package com.purchasingpower.fullcycle.workflow.steps;

import com.purchasingpower.fullcycle.exception.PipelineException;
import com.purchasingpower.fullcycle.model.PipelineConfig;
import com.purchasingpower.fullcycle.service.PullRequestGateway;
import com.purchasingpower.fullcycle.util.Sleeper;
import com.purchasingpower.fullcycle.workflow.agents.ChangeApplier;
import com.purchasingpower.fullcycle.workflow.agents.CiFailureAnalyzer;
import com.purchasingpower.fullcycle.workflow.agents.RewriteOutcome;
import com.purchasingpower.fullcycle.workflow.pipeline.RunContext;
import com.purchasingpower.fullcycle.workflow.state.BuildResult;
import com.purchasingpower.fullcycle.workflow.state.CIResult;
import com.purchasingpower.fullcycle.workflow.state.CiFailureType;
import com.purchasingpower.fullcycle.workflow.state.CiStatus;
import com.purchasingpower.fullcycle.workflow.state.PipelineState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Waits for CI on the run's pull request and pushes LLM fixes for failed runs.
 *
 * <p>Each failed CI run counts as one attempt and is followed by a fix commit; after
 * {@code maxCIRetries} failed runs the run fails. The pull request is never closed here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CIWatcher {

    private final PullRequestGateway pullRequestGateway;
    private final CiFailureAnalyzer failureAnalyzer;
    private final ChangeApplier changeApplier;
    private final LocalValidator localValidator;
    private final Sleeper sleeper;

    public CiOutcome watch(RunContext ctx) {
        PipelineConfig config = ctx.getConfig();
        int prNumber = ctx.getPullRequest().number();
        int attempts = 0;

        while (true) {
            ctx.transition(new PipelineState.WaitingForCI(prNumber));
            ctx.incrementCiRuns();
            ctx.progress("⏳ Waiting for CI on PR #" + prNumber + "...");

            Optional<CIResult> verdict = awaitVerdict(ctx, prNumber);
            if (verdict.isEmpty()) {
                return CiOutcome.failed(attempts, "CI did not finish within " + describe(config.getCiWaitWindow())
                        + " (PR #" + prNumber + " left open)");
            }

            CIResult result = verdict.get();
            switch (result.getStatus()) {
                case SUCCESS -> {
                    ctx.progress("✅ CI passed");
                    return CiOutcome.passed(attempts);
                }
                case CANCELLED -> {
                    ctx.error("CI run was cancelled");
                    return CiOutcome.failed(attempts, "CI run was cancelled");
                }
                case FAILED -> {
                    attempts++;
                    String error = result.getErrorMessage() != null ? result.getErrorMessage() : "Unknown error";
                    ctx.progress("❌ CI failed: " + error);
                    ctx.transition(new PipelineState.FixingCIError(error, attempts));

                    if (!fix(ctx, result, attempts)) {
                        ctx.error("CI error: " + error);
                    }
                    if (attempts >= config.getMaxCIRetries()) {
                        return CiOutcome.failed(attempts, "CI failed after " + attempts + " attempts");
                    }
                }
                default -> log.warn("Unexpected non-final CI status {}", result.getStatus());
            }
        }
    }

    /**
     * Poll until CI reports a final status or the wait window closes.
     */
    Optional<CIResult> awaitVerdict(RunContext ctx, int prNumber) {
        Duration interval = ctx.getConfig().getCiPollInterval();
        Duration window = ctx.getConfig().getCiWaitWindow();
        long polls = interval.isZero() ? 1 : Math.max(1, window.toMillis() / interval.toMillis());

        for (long poll = 1; poll <= polls; poll++) {
            CIResult result;
            try {
                result = pullRequestGateway.getCiStatus(ctx.getRepository(), prNumber);
            } catch (PipelineException e) {
                log.warn("⚠️ CI status unavailable ({}), will retry", e.getMessage());
                result = CIResult.pending();
            }
            if (result.getStatus().isFinal()) {
                return Optional.of(result);
            }
            log.debug("CI status {} (poll {}/{})", result.getStatus(), poll, polls);
            if (poll < polls) {
                sleeper.sleep(interval);
            }
        }
        return Optional.empty();
    }

    private boolean fix(RunContext ctx, CIResult result, int attempt) {
        String logs = fetchLogs(ctx, result);
        if (logs.isBlank()) {
            ctx.progress("📥 CI logs unavailable, rebuilding locally for diagnostics");
            logs = localValidator.buildOnce(ctx).map(BuildResult::getBuildLogs).orElse("");
        }

        CiFailureType type = failureAnalyzer.classify(logs);
        String excerpt = failureAnalyzer.excerpt(logs);
        List<String> candidates = failureAnalyzer.candidateFiles(ctx.getProjectRoot(), logs, ctx.getTouchedPaths());
        ctx.progress(String.format("🔍 CI failure classified as %s, %d candidate files", type.getLabel(), candidates.size()));

        List<String> written = new ArrayList<>();
        for (String path : candidates) {
            RewriteOutcome outcome = changeApplier.rewrite(ctx, path, "ci-fix", Map.of(
                    "failureType", type.getLabel(),
                    "checkName", result.getCheckName() == null ? "" : result.getCheckName(),
                    "errorMessage", result.getErrorMessage() == null ? "" : result.getErrorMessage(),
                    "logExcerpt", excerpt.isBlank() ? "(no log output available)" : excerpt));
            if (outcome.isWritten()) {
                written.add(path);
            }
        }

        if (written.isEmpty()) {
            ctx.progress("⚠️ No CI fix could be applied");
            return false;
        }
        return ctx.getVcs().commitAndPush(written, "fix: resolve CI failure (attempt " + attempt + ")",
                ctx.getBranchName());
    }

    private String fetchLogs(RunContext ctx, CIResult result) {
        try {
            return Optional.ofNullable(result.getRunId())
                    .or(() -> pullRequestGateway.findLatestFailedRunId(ctx.getRepository(), ctx.getBranchName()))
                    .map(runId -> pullRequestGateway.fetchRunLogs(ctx.getRepository(), runId))
                    .orElse("");
        } catch (PipelineException e) {
            log.warn("⚠️ Could not fetch CI logs: {}", e.getMessage());
            return "";
        }
    }

    private static String describe(Duration window) {
        return window.toMinutes() > 0 ? window.toMinutes() + " minutes" : window.toSeconds() + " seconds";
    }
}
