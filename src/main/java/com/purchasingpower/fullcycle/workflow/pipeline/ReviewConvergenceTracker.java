package com.purchasingpower.fullcycle.workflow.pipeline;

import com.purchasingpower.fullcycle.workflow.state.ReviewIssue;
import com.purchasingpower.fullcycle.workflow.state.SelfReviewResult;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Detects a self-review loop that keeps reporting the same non-critical findings.
 *
 * <p>Three rules, all requiring zero CRITICAL issues in the current review:
 * <ul>
 *   <li><b>stuck</b>: the findings overlap by at least 80% with one of the last three reviews</li>
 *   <li><b>fatigue</b>: three reviews in a row without a CRITICAL issue</li>
 *   <li><b>ceiling</b>: the loop reached its fifth iteration</li>
 * </ul>
 */
public class ReviewConvergenceTracker {

    static final int HISTORY_SIZE = 3;
    static final double STUCK_OVERLAP = 0.8;
    static final int FATIGUE_STREAK = 3;
    static final int CEILING_ITERATION = 5;
    private static final int SIGNATURE_MESSAGE_CHARS = 50;

    private final Deque<Set<String>> history = new ArrayDeque<>();
    private int criticalFreeStreak;

    /**
     * Record a review that did not approve and decide whether to force approval.
     *
     * @return the reason to force-approve, or empty to keep fixing
     */
    public Optional<String> observe(int iteration, SelfReviewResult result) {
        Set<String> signatures = signatures(result.getBlockingIssues());
        boolean hasCritical = result.countOf(ReviewIssue.Severity.CRITICAL) > 0;
        criticalFreeStreak = hasCritical ? 0 : criticalFreeStreak + 1;

        String reason = null;
        if (!hasCritical) {
            double best = history.stream().mapToDouble(previous -> overlap(previous, signatures)).max().orElse(0);
            if (best >= STUCK_OVERLAP) {
                reason = String.format("stuck: %.0f%% of the findings repeat an earlier review", best * 100);
            } else if (criticalFreeStreak >= FATIGUE_STREAK) {
                reason = "fatigue: " + criticalFreeStreak + " reviews in a row without critical issues";
            } else if (iteration >= CEILING_ITERATION) {
                reason = "ceiling: iteration " + iteration + " without critical issues";
            }
        }

        history.addLast(signatures);
        if (history.size() > HISTORY_SIZE) {
            history.removeFirst();
        }
        return Optional.ofNullable(reason);
    }

    /**
     * {@code file:line:first 50 chars of message} for each issue.
     */
    public static Set<String> signatures(Collection<ReviewIssue> issues) {
        Set<String> signatures = new LinkedHashSet<>();
        for (ReviewIssue issue : issues) {
            String message = issue.getMessage() == null ? "" : issue.getMessage().trim();
            if (message.length() > SIGNATURE_MESSAGE_CHARS) {
                message = message.substring(0, SIGNATURE_MESSAGE_CHARS);
            }
            signatures.add(issue.getFile() + ":" + (issue.getLine() == null ? "" : issue.getLine()) + ":" + message);
        }
        return signatures;
    }

    /**
     * |A ∩ B| / max(|A|, |B|); zero when both are empty.
     */
    public static double overlap(Set<String> a, Set<String> b) {
        int larger = Math.max(a.size(), b.size());
        if (larger == 0) {
            return 0;
        }
        Set<String> common = new HashSet<>(a);
        common.retainAll(b);
        return (double) common.size() / larger;
    }
}
