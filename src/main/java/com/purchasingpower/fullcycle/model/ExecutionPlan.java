package com.purchasingpower.fullcycle.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * The set of intended file changes, produced once per run before any code is written.
 */
@Value
@Builder
public class ExecutionPlan {

    String taskDescription;

    List<PlannedChange> plannedChanges;

    int estimatedFilesCount;

    String summary;

    public ExecutionPlan(String taskDescription, List<PlannedChange> plannedChanges,
                         int estimatedFilesCount, String summary) {
        this.taskDescription = taskDescription;
        this.plannedChanges = plannedChanges == null ? List.of() : List.copyOf(plannedChanges);
        this.estimatedFilesCount = estimatedFilesCount;
        this.summary = summary;
    }

    /**
     * True when every entry deletes a file; such plans have nothing to review.
     */
    public boolean isDeleteOnly() {
        return !plannedChanges.isEmpty()
                && plannedChanges.stream().allMatch(c -> c.getChangeType().isDelete());
    }

    /**
     * Human readable listing, one "+ path - description" line per entry.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(summary == null ? "" : summary).append('\n');
        for (PlannedChange change : plannedChanges) {
            sb.append("  ").append(change.getChangeType().getIcon()).append(' ')
                    .append(change.getFilePath());
            if (change.getDescription() != null && !change.getDescription().isBlank()) {
                sb.append(" - ").append(change.getDescription());
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
