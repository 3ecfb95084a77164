package com.purchasingpower.fullcycle.workflow.state;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one local build or test invocation, with the diagnostics parsed from its output.
 */
@Value
@Builder
public class BuildResult {

    boolean success;

    @Singular
    List<CompilationError> compilationErrors;

    /**
     * Fully qualified names of test classes reported as failing.
     */
    @Singular
    List<String> failedTests;

    String buildLogs;

    long durationMs;

    public static BuildResult skipped() {
        return BuildResult.builder().success(true).buildLogs("").build();
    }

    /**
     * Last {@code maxChars} characters of the log; the end of a build log holds the errors.
     */
    public String logTail(int maxChars) {
        if (buildLogs == null) {
            return "";
        }
        return buildLogs.length() <= maxChars ? buildLogs : buildLogs.substring(buildLogs.length() - maxChars);
    }
}
