package com.purchasingpower.fullcycle.workflow.agents;

import com.purchasingpower.fullcycle.model.FileChange;

/**
 * What happened to one guarded LLM rewrite of a file.
 */
public record RewriteOutcome(String path, Status status, FileChange change) {

    public enum Status {
        WRITTEN,
        UNCHANGED,
        /** Anti-truncation guard discarded the rewrite; the file is untouched. */
        REJECTED_TRUNCATED,
        /** The LLM answered with nothing but whitespace; the file is untouched. */
        REJECTED_EMPTY,
        SKIPPED_PROTECTED,
        SKIPPED_MISSING,
        FAILED
    }

    public boolean isWritten() {
        return status == Status.WRITTEN;
    }

    static RewriteOutcome of(String path, Status status) {
        return new RewriteOutcome(path, status, null);
    }
}
