package com.purchasingpower.fullcycle.workflow.steps;

import com.purchasingpower.fullcycle.exception.PipelineException;
import com.purchasingpower.fullcycle.model.PipelineConfig;
import com.purchasingpower.fullcycle.service.PullRequestGateway;
import com.purchasingpower.fullcycle.service.ReviewService;
import com.purchasingpower.fullcycle.workflow.agents.ChangeApplier;
import com.purchasingpower.fullcycle.workflow.agents.RewriteOutcome;
import com.purchasingpower.fullcycle.workflow.pipeline.RunContext;
import com.purchasingpower.fullcycle.workflow.state.PipelineState;
import com.purchasingpower.fullcycle.workflow.state.ReviewIssue;
import com.purchasingpower.fullcycle.workflow.state.SelfReviewResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Reviews the open pull request and fixes CRITICAL and WARNING findings until the review
 * converges or the iteration budget is spent.
 *
 * <p>Never fails the run: an unavailable review service counts as an approval, and running out
 * of iterations hands over to CI with a warning.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SelfReviewLoop {

    private final ReviewService reviewService;
    private final PullRequestGateway pullRequestGateway;
    private final ChangeApplier changeApplier;

    public ReviewOutcome run(RunContext ctx) {
        if (ctx.getPlan() != null && ctx.getPlan().isDeleteOnly()) {
            ctx.progress("⏭️ Plan only deletes files, skipping self-review");
            return new ReviewOutcome(true, 0, "delete-only plan");
        }

        PipelineConfig config = ctx.getConfig();
        int maxIterations = config.getMaxReviewIterations();
        int prNumber = ctx.getPullRequest().number();

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            ctx.transition(new PipelineState.Reviewing(iteration, maxIterations));
            ctx.incrementReviewIterations();
            ctx.progress(String.format("👀 Self-review %d/%d of PR #%d", iteration, maxIterations, prNumber));

            SelfReviewResult result;
            try {
                String diff = pullRequestGateway.getPullRequestDiff(ctx.getRepository(), prNumber);
                result = reviewService.review(ctx.getTaskDescription(), diff);
            } catch (PipelineException e) {
                ctx.warn("Review service unavailable, treating PR as approved: " + e.getMessage());
                return new ReviewOutcome(true, iteration, "review service unavailable");
            }

            publish(ctx, prNumber, result, iteration);

            List<ReviewIssue> blocking = result.getBlockingIssues();
            if (result.isApproved() || blocking.isEmpty()) {
                ctx.progress("✅ Review approved at iteration " + iteration);
                return new ReviewOutcome(true, iteration, "approved");
            }

            if (config.isForceApproveEnabled()) {
                Optional<String> forced = ctx.getConvergenceTracker().observe(iteration, result);
                if (forced.isPresent()) {
                    ctx.progress("✅ Review force-approved at iteration " + iteration + " (" + forced.get() + ")");
                    ctx.warn("Review force-approved: " + forced.get());
                    return new ReviewOutcome(true, iteration, "force-approved: " + forced.get());
                }
            }

            ctx.transition(new PipelineState.FixingReviewComments(iteration, blocking.size()));
            ctx.progress(String.format("🔧 Fixing %d issues (critical: %d, warnings: %d)", blocking.size(),
                    result.countOf(ReviewIssue.Severity.CRITICAL), result.countOf(ReviewIssue.Severity.WARNING)));
            List<String> written = fix(ctx, blocking);

            if (written.isEmpty()) {
                log.warn("⚠️ Review iteration {} produced no file changes", iteration);
                continue;
            }
            ctx.getVcs().commitAndPush(written, "fix: address review comments (iteration " + iteration + ")",
                    ctx.getBranchName());
        }

        // Informational only: no caller answers, the run continues to CI
        ctx.transition(new PipelineState.NeedsUserInput(
                "Review iteration limit reached (" + maxIterations + "). Continue?",
                List.of("Continue to CI", "Leave PR open", "Merge as is")));
        ctx.warn("Self-review did not converge after " + maxIterations + " iterations, proceeding to CI");
        return new ReviewOutcome(false, maxIterations, "iterations exhausted");
    }

    private List<String> fix(RunContext ctx, List<ReviewIssue> blocking) {
        Map<String, List<ReviewIssue>> byFile = new LinkedHashMap<>();
        for (ReviewIssue issue : blocking) {
            ChangeApplier.toProjectPath(ctx.getProjectRoot(), issue.getFile())
                    .ifPresent(path -> byFile.computeIfAbsent(path, k -> new ArrayList<>()).add(issue));
        }

        List<String> written = new ArrayList<>();
        for (Map.Entry<String, List<ReviewIssue>> entry : byFile.entrySet()) {
            RewriteOutcome outcome = changeApplier.rewrite(ctx, entry.getKey(), "review-fix",
                    Map.of("issues", formatIssues(entry.getValue())));
            if (outcome.isWritten()) {
                written.add(entry.getKey());
            }
        }
        return written;
    }

    private void publish(RunContext ctx, int prNumber, SelfReviewResult result, int iteration) {
        try {
            pullRequestGateway.publishReview(ctx.getRepository(), prNumber, result.toMarkdown(iteration));
        } catch (PipelineException e) {
            log.warn("⚠️ Could not publish review on PR #{}: {}", prNumber, e.getMessage());
        }
    }

    static String formatIssues(List<ReviewIssue> issues) {
        return issues.stream()
                .map(i -> "- [" + i.getSeverity() + "]"
                        + (i.getLine() != null ? " line " + i.getLine() : "")
                        + ": " + i.getMessage()
                        + (i.getSuggestedFix() != null && !i.getSuggestedFix().isBlank()
                        ? "\n  Suggested fix: " + i.getSuggestedFix() : ""))
                .collect(Collectors.joining("\n"));
    }
}
