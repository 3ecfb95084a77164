package com.purchasingpower.fullcycle.service;

import java.util.List;

/**
 * Result of starting or continuing a rebase.
 */
public record RebaseOutcome(Status status, List<String> conflictingFiles, String message) {

    public enum Status {
        /** Rebase finished (or there was nothing to do). */
        OK,
        /** Rebase stopped on a commit with conflicts; resolve, then continue. */
        CONFLICTS,
        /** Rebase could not run or continue; it must be aborted. */
        FAILED
    }

    public RebaseOutcome {
        conflictingFiles = conflictingFiles == null ? List.of() : List.copyOf(conflictingFiles);
    }

    public static RebaseOutcome ok() {
        return new RebaseOutcome(Status.OK, List.of(), "");
    }

    public static RebaseOutcome conflicts(List<String> files) {
        return new RebaseOutcome(Status.CONFLICTS, files, "Conflicts in " + files);
    }

    public static RebaseOutcome failed(String message) {
        return new RebaseOutcome(Status.FAILED, List.of(), message);
    }
}
