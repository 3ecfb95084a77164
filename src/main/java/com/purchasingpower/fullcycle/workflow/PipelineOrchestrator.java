package com.purchasingpower.fullcycle.workflow;

import com.purchasingpower.fullcycle.config.GitHubProperties;
import com.purchasingpower.fullcycle.exception.PipelineException;
import com.purchasingpower.fullcycle.model.ExecutionPlan;
import com.purchasingpower.fullcycle.model.FileChange;
import com.purchasingpower.fullcycle.model.Mergeability;
import com.purchasingpower.fullcycle.model.PipelineConfig;
import com.purchasingpower.fullcycle.model.PipelineReport;
import com.purchasingpower.fullcycle.model.PullRequestRef;
import com.purchasingpower.fullcycle.model.RepositoryCoordinates;
import com.purchasingpower.fullcycle.service.ContextProvider;
import com.purchasingpower.fullcycle.service.ProjectFileScanner;
import com.purchasingpower.fullcycle.service.PullRequestGateway;
import com.purchasingpower.fullcycle.service.VersionControlDriver;
import com.purchasingpower.fullcycle.service.VersionControlDriverFactory;
import com.purchasingpower.fullcycle.service.git.GitHubUrlParser;
import com.purchasingpower.fullcycle.util.Sleeper;
import com.purchasingpower.fullcycle.workflow.agents.ChangeApplier;
import com.purchasingpower.fullcycle.workflow.agents.TaskPlanner;
import com.purchasingpower.fullcycle.workflow.pipeline.PipelineRequest;
import com.purchasingpower.fullcycle.workflow.pipeline.RunContext;
import com.purchasingpower.fullcycle.workflow.state.PipelineState;
import com.purchasingpower.fullcycle.workflow.steps.CIWatcher;
import com.purchasingpower.fullcycle.workflow.steps.CiOutcome;
import com.purchasingpower.fullcycle.workflow.steps.ConflictResolver;
import com.purchasingpower.fullcycle.workflow.steps.LocalValidator;
import com.purchasingpower.fullcycle.workflow.steps.ReviewOutcome;
import com.purchasingpower.fullcycle.workflow.steps.SelfReviewLoop;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs one task from plan to merged pull request.
 *
 * <p>Sequence: plan, confirm, apply, validate locally, branch, commit, push, open PR,
 * self-review (with fix cycle), wait for CI (with fix cycle), resolve conflicts, merge.
 * {@link #run} never throws: every failure ends in a {@link PipelineState.Failed} state and a
 * report with {@code success=false}, keeping whatever branch and PR already exist.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineOrchestrator {

    static final int CONTEXT_TOP_K = 5;
    static final double CONTEXT_MIN_SIMILARITY = 0.3;
    static final int MERGEABILITY_POLLS = 5;
    static final Set<String> PROTECTED_BRANCHES = Set.of("main", "master");

    private final VersionControlDriverFactory vcsFactory;
    private final PullRequestGateway pullRequestGateway;
    private final ContextProvider contextProvider;
    private final ProjectFileScanner fileScanner;
    private final TaskPlanner taskPlanner;
    private final ChangeApplier changeApplier;
    private final LocalValidator localValidator;
    private final SelfReviewLoop selfReviewLoop;
    private final CIWatcher ciWatcher;
    private final ConflictResolver conflictResolver;
    private final GitHubProperties gitHubProperties;
    private final Sleeper sleeper;

    public PipelineReport run(PipelineRequest request) {
        RunContext ctx = new RunContext(request.getTaskDescription(), request.getProjectRoot(),
                request.getConfig(), request.getListener());
        log.info("🚀 Starting pipeline run {} for task: {}", ctx.getRunId(), ctx.getTaskDescription());

        try {
            return execute(ctx, request);
        } catch (PipelineException e) {
            log.error("❌ Pipeline run {} failed: {}", ctx.getRunId(), e.getMessage(), e);
            return fail(ctx, e.getMessage(), e.isRecoverable());
        } catch (RuntimeException e) {
            log.error("❌ Pipeline run {} failed unexpectedly", ctx.getRunId(), e);
            return fail(ctx, "Unexpected error: " + e.getClass().getSimpleName() + ": " + e.getMessage(), false);
        } finally {
            close(ctx);
        }
    }

    private PipelineReport execute(RunContext ctx, PipelineRequest request) {
        PipelineConfig config = ctx.getConfig();

        // === Analysis and planning ===
        ctx.transition(new PipelineState.Analyzing());
        ctx.progress("🔍 Analyzing task...");
        ctx.setVcs(vcsFactory.open(ctx.getProjectRoot()));
        ctx.setRepository(resolveRepository(ctx.getVcs()));
        ctx.setRetrievedContext(retrieveContext(ctx));

        ExecutionPlan plan = taskPlanner.plan(ctx.getTaskDescription(), ctx.getRetrievedContext(),
                fileScanner.listFiles(ctx.getProjectRoot()));
        ctx.setPlan(plan);
        ctx.transition(new PipelineState.PlanReady(plan));
        ctx.progress("📋 Plan:\n" + plan.describe());

        ctx.transition(new PipelineState.AwaitingConfirmation(plan));
        if (!request.getConfirmation().confirmPlan(plan)) {
            return fail(ctx, "Cancelled by user", false);
        }

        // === Changes and local validation ===
        ctx.transition(new PipelineState.MakingChanges(plan.getPlannedChanges().size()));
        changeApplier.apply(ctx);
        localValidator.validate(ctx);

        // === Branch, commit, push ===
        VersionControlDriver vcs = ctx.getVcs();
        String currentBranch = vcs.currentBranch();
        if (currentBranch.equals(config.getBaseBranch()) || PROTECTED_BRANCHES.contains(currentBranch)) {
            String branchName = branchName(ctx.getTaskDescription(), Instant.now().getEpochSecond());
            ctx.transition(new PipelineState.CreatingBranch(branchName));
            ctx.progress("🌿 Creating branch " + branchName);
            vcs.createAndCheckoutBranch(branchName);
            ctx.setBranchName(branchName);
        } else {
            ctx.progress("🌿 Reusing current branch " + currentBranch);
            ctx.setBranchName(currentBranch);
        }

        String commitMessage = commitMessage(ctx.getTaskDescription());
        ctx.transition(new PipelineState.Committing(commitMessage));
        vcs.stage(ctx.getTouchedPaths());
        if (!vcs.commit(commitMessage)) {
            throw new PipelineException("Nothing to commit: the applied changes left the working tree unchanged");
        }

        ctx.transition(new PipelineState.Pushing(ctx.getBranchName()));
        ctx.progress("⬆️ Pushing " + ctx.getBranchName());
        vcs.push(ctx.getBranchName(), false);

        // === Pull request ===
        ctx.transition(new PipelineState.CreatingPR(ctx.getBranchName()));
        PullRequestRef pr = pullRequestGateway.findOpenPullRequest(ctx.getRepository(), ctx.getBranchName())
                .orElseGet(() -> pullRequestGateway.createPullRequest(ctx.getRepository(), commitMessage,
                        pullRequestBody(ctx), ctx.getBranchName(), config.getBaseBranch()));
        ctx.setPullRequest(pr);
        ctx.progress("📬 Pull request #" + pr.number() + ": " + pr.url());

        // === Self-review ===
        ReviewOutcome review = selfReviewLoop.run(ctx);
        log.info("Self-review finished: {} after {} iterations", review.reason(), review.iterations());

        // === CI ===
        if (config.isRequireCIPass()) {
            CiOutcome ci = ciWatcher.watch(ctx);
            if (!ci.passed()) {
                return fail(ctx, ci.failureReason(), true);
            }
        } else {
            ctx.progress("⏭️ CI wait disabled");
        }

        // === Merge ===
        if (!config.isAutoMerge()) {
            return complete(ctx, "PR #" + pr.number() + " is ready for review: " + pr.url());
        }

        Mergeability mergeability = awaitMergeability(ctx, pr.number());
        if (mergeability == Mergeability.CONFLICTING) {
            conflictResolver.resolve(ctx);
        }

        ctx.transition(new PipelineState.Merging(pr.number()));
        ctx.progress("🔀 Merging PR #" + pr.number() + " (" + config.getMergeMethod().getApiValue() + ")");
        pullRequestGateway.merge(ctx.getRepository(), pr.number(), config.getMergeMethod(),
                commitMessage + " (#" + pr.number() + ")");

        if (config.isDeleteBranchAfterMerge()) {
            cleanupAfterMerge(ctx);
        }
        return complete(ctx, "PR #" + pr.number() + " merged into " + config.getBaseBranch());
    }

    private RepositoryCoordinates resolveRepository(VersionControlDriver vcs) {
        if (!gitHubProperties.getOwner().isBlank() && !gitHubProperties.getRepo().isBlank()) {
            return new RepositoryCoordinates(gitHubProperties.getOwner(), gitHubProperties.getRepo());
        }
        return vcs.remoteUrl("origin")
                .flatMap(GitHubUrlParser::parse)
                .orElseThrow(() -> new PipelineException(
                        "Cannot determine the GitHub repository: set app.github.owner/repo or use a github.com origin remote"));
    }

    private String retrieveContext(RunContext ctx) {
        try {
            String context = contextProvider.search(ctx.getTaskDescription(), CONTEXT_TOP_K, CONTEXT_MIN_SIMILARITY);
            return context == null ? "" : context;
        } catch (RuntimeException e) {
            ctx.warn("Context search failed, planning without context: " + e.getMessage());
            return "";
        }
    }

    private Mergeability awaitMergeability(RunContext ctx, int prNumber) {
        Mergeability mergeability = Mergeability.UNKNOWN;
        for (int poll = 1; poll <= MERGEABILITY_POLLS; poll++) {
            mergeability = pullRequestGateway.getMergeability(ctx.getRepository(), prNumber);
            if (mergeability != Mergeability.UNKNOWN) {
                return mergeability;
            }
            if (poll < MERGEABILITY_POLLS) {
                sleeper.sleep(ctx.getConfig().getCiPollInterval());
            }
        }
        log.warn("⚠️ Mergeability of PR #{} still unknown, attempting merge anyway", prNumber);
        return mergeability;
    }

    private void cleanupAfterMerge(RunContext ctx) {
        String base = ctx.getConfig().getBaseBranch();
        VersionControlDriver vcs = ctx.getVcs();
        try {
            vcs.checkout(base);
            vcs.pull(base);
            vcs.deleteBranch(ctx.getBranchName());
            ctx.progress("🧹 Switched to " + base + " and deleted " + ctx.getBranchName());
        } catch (PipelineException e) {
            ctx.warn("Post-merge cleanup failed: " + e.getMessage());
        }
    }

    private PipelineReport complete(RunContext ctx, String summary) {
        PipelineReport report = report(ctx, true, summary);
        ctx.transition(new PipelineState.Completed(report));
        ctx.progress("✅ " + summary);
        return report;
    }

    private PipelineReport fail(RunContext ctx, String reason, boolean recoverable) {
        ctx.error(reason);
        ctx.transition(new PipelineState.Failed(reason, recoverable));
        ctx.progress("❌ " + reason);
        return report(ctx, false, reason);
    }

    private PipelineReport report(RunContext ctx, boolean success, String summary) {
        PullRequestRef pr = ctx.getPullRequest();
        return PipelineReport.builder()
                .success(success)
                .prNumber(pr == null ? null : pr.number())
                .prUrl(pr == null ? null : pr.url())
                .branchName(ctx.getBranchName())
                .changedFiles(ctx.getChangedFiles())
                .reviewIterations(ctx.getReviewIterations())
                .ciRuns(ctx.getCiRuns())
                .totalDuration(Duration.between(ctx.getStartedAt(), Instant.now()))
                .summary(summary)
                .errors(ctx.getErrors())
                .warnings(ctx.getWarnings())
                .stateVisits(ctx.getStatistics().getStateVisits())
                .build();
    }

    private void close(RunContext ctx) {
        if (ctx.getVcs() == null) {
            return;
        }
        try {
            ctx.getVcs().close();
        } catch (RuntimeException e) {
            log.warn("Failed to close repository: {}", e.getMessage());
        }
    }

    /**
     * {@code feature/ai-<epochSeconds>-<slug>} where the slug is built from the first three words.
     */
    static String branchName(String task, long epochSeconds) {
        String slug = Arrays.stream(task.trim().toLowerCase(Locale.ROOT).split("\\s+"))
                .limit(3)
                .map(word -> word.length() > 15 ? word.substring(0, 15) : word)
                .collect(Collectors.joining("-"))
                .replaceAll("[^a-z0-9-]", "")
                .replaceAll("-{2,}", "-");
        if (slug.length() > 30) {
            slug = slug.substring(0, 30);
        }
        slug = slug.replaceAll("^-+|-+$", "");
        return "feature/ai-" + epochSeconds + "-" + (slug.isEmpty() ? "task" : slug);
    }

    static String commitMessage(String task) {
        String lower = task.toLowerCase(Locale.ROOT);
        String type;
        if (lower.contains("fix") || lower.contains("bug") || lower.contains("error") || lower.contains("исправ")) {
            type = "fix";
        } else if (lower.contains("refactor")) {
            type = "refactor";
        } else if (lower.contains("doc") || lower.contains("readme")) {
            type = "docs";
        } else {
            type = "feat";
        }
        String subject = task.trim().replaceAll("\\s+", " ");
        return type + ": " + (subject.length() > 50 ? subject.substring(0, 50) : subject);
    }

    static String pullRequestBody(RunContext ctx) {
        StringBuilder body = new StringBuilder();
        body.append("## Description\n\n").append(ctx.getTaskDescription()).append("\n\n");
        body.append("## Changes\n\n");
        ExecutionPlan plan = ctx.getPlan();
        if (plan != null && plan.getSummary() != null && !plan.getSummary().isBlank()) {
            body.append(plan.getSummary()).append("\n\n");
        }
        List<String> lines = new ArrayList<>();
        for (FileChange change : ctx.getChangedFiles()) {
            lines.add("- `" + change.path() + "` (+" + change.linesAdded() + "/-" + change.linesRemoved() + ")"
                    + (change.isNew() ? " new" : ""));
        }
        body.append(String.join("\n", lines)).append("\n\n");
        body.append("---\n🤖 Generated by fullcycle-pipeline\n");
        return body.toString();
    }
}
