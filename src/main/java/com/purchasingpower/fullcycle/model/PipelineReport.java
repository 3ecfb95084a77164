package com.purchasingpower.fullcycle.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Final outcome of one pipeline run. Created exactly once, when the run reaches a terminal state.
 *
 * <p>PR and branch fields are {@code null} when the run failed before they existed; when they are
 * set on a failed run, the branch and PR were left in place for manual follow-up.
 */
@Value
@Builder
public class PipelineReport {

    boolean success;

    Integer prNumber;

    String prUrl;

    String branchName;

    @Singular
    List<FileChange> changedFiles;

    int reviewIterations;

    int ciRuns;

    Duration totalDuration;

    String summary;

    @Singular
    List<String> errors;

    @Singular
    List<String> warnings;

    @Singular
    Map<String, Integer> stateVisits;

    public int getTotalLinesAdded() {
        return changedFiles.stream().mapToInt(FileChange::linesAdded).sum();
    }

    public int getTotalLinesRemoved() {
        return changedFiles.stream().mapToInt(FileChange::linesRemoved).sum();
    }
}
