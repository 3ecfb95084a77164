package com.purchasingpower.fullcycle.workflow.state;

import com.purchasingpower.fullcycle.model.ExecutionPlan;
import com.purchasingpower.fullcycle.model.PipelineReport;

import java.util.List;

/**
 * Current stage of a pipeline run.
 *
 * <p>Closed set of variants: a {@code switch} over a {@code PipelineState} can be checked for
 * exhaustiveness. Transitions only move forward, except for the two bounded cycles
 * Reviewing/FixingReviewComments and WaitingForCI/FixingCIError.
 */
public sealed interface PipelineState {

    /**
     * Stable display name, used for logs and run statistics.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * True for Completed and Failed.
     */
    default boolean isTerminal() {
        return this instanceof Completed || this instanceof Failed;
    }

    record Analyzing() implements PipelineState {
    }

    record PlanReady(ExecutionPlan plan) implements PipelineState {
    }

    record AwaitingConfirmation(ExecutionPlan plan) implements PipelineState {
    }

    record MakingChanges(int plannedCount) implements PipelineState {
    }

    record ValidatingLocally(String phase, int attempt) implements PipelineState {
    }

    record CreatingBranch(String branchName) implements PipelineState {
    }

    record Committing(String message) implements PipelineState {
    }

    record Pushing(String branch) implements PipelineState {
    }

    record CreatingPR(String branch) implements PipelineState {
    }

    record Reviewing(int iteration, int maxIterations) implements PipelineState {
    }

    record FixingReviewComments(int iteration, int issueCount) implements PipelineState {
    }

    record WaitingForCI(int prNumber) implements PipelineState {
    }

    record FixingCIError(String error, int attempt) implements PipelineState {
    }

    record ResolvingConflicts(List<String> files) implements PipelineState {
        public ResolvingConflicts {
            files = List.copyOf(files);
        }
    }

    record Merging(int prNumber) implements PipelineState {
    }

    record Completed(PipelineReport report) implements PipelineState {
    }

    record Failed(String reason, boolean recoverable) implements PipelineState {
    }

    record NeedsUserInput(String question, List<String> options) implements PipelineState {
        public NeedsUserInput {
            options = List.copyOf(options);
        }
    }
}
