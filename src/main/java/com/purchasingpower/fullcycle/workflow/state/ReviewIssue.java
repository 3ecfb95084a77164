package com.purchasingpower.fullcycle.workflow.state;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * Single finding of an automated code review.
 */
@Value
@Builder
public class ReviewIssue {

    String file;

    /**
     * 1-based line number, or {@code null} when the finding is about the whole file.
     */
    Integer line;

    Severity severity;

    String message;

    String suggestedFix;

    public enum Severity {
        CRITICAL,   // Must fix
        WARNING,    // Should fix
        SUGGESTION, // Nice to have
        NITPICK;    // Style only

        public static Severity fromString(String value) {
            if (value == null) {
                return SUGGESTION;
            }
            return switch (value.trim().toUpperCase(Locale.ROOT)) {
                case "CRITICAL", "BLOCKER", "ERROR", "HIGH" -> CRITICAL;
                case "WARNING", "WARN", "MAJOR", "MEDIUM" -> WARNING;
                case "NITPICK", "NIT", "STYLE", "TRIVIAL" -> NITPICK;
                default -> SUGGESTION;
            };
        }
    }

    /**
     * CRITICAL and WARNING issues are the only ones worth a fix round.
     */
    public boolean isBlocking() {
        return severity == Severity.CRITICAL || severity == Severity.WARNING;
    }
}
