package com.purchasingpower.fullcycle.workflow.state;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

@Value
@Builder
public class SelfReviewResult {

    boolean approved;

    @Singular
    List<ReviewIssue> issues;

    String overallAssessment;

    public List<ReviewIssue> getBlockingIssues() {
        return issues.stream().filter(ReviewIssue::isBlocking).toList();
    }

    public long countOf(ReviewIssue.Severity severity) {
        return issues.stream().filter(i -> i.getSeverity() == severity).count();
    }

    /**
     * Markdown body used when the review is published on the pull request,
     * grouped by severity from most to least important.
     */
    public String toMarkdown(int iteration) {
        StringBuilder sb = new StringBuilder();
        sb.append("## 🤖 Self-review (iteration ").append(iteration).append(")\n\n");
        if (overallAssessment != null && !overallAssessment.isBlank()) {
            sb.append(overallAssessment.trim()).append("\n\n");
        }
        appendSection(sb, "🔴 Critical Issues", ReviewIssue.Severity.CRITICAL);
        appendSection(sb, "🟡 Warnings", ReviewIssue.Severity.WARNING);
        appendSection(sb, "💡 Suggestions", ReviewIssue.Severity.SUGGESTION);
        appendSection(sb, "📝 Nitpicks", ReviewIssue.Severity.NITPICK);
        sb.append("**Verdict:** ").append(approved ? "APPROVE" : "REQUEST_CHANGES").append('\n');
        return sb.toString();
    }

    private void appendSection(StringBuilder sb, String title, ReviewIssue.Severity severity) {
        List<ReviewIssue> matching = issues.stream().filter(i -> i.getSeverity() == severity).toList();
        if (matching.isEmpty()) {
            return;
        }
        sb.append("### ").append(title).append('\n');
        sb.append(matching.stream()
                .map(i -> "- **" + i.getFile() + (i.getLine() != null ? ":" + i.getLine() : "") + "** "
                        + i.getMessage())
                .collect(Collectors.joining("\n")));
        sb.append("\n\n");
    }
}
