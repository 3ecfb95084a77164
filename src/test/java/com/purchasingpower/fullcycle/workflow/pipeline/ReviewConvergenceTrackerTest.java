package com.purchasingpower.fullcycle.workflow.pipeline;

import com.purchasingpower.fullcycle.workflow.state.ReviewIssue;
import com.purchasingpower.fullcycle.workflow.state.SelfReviewResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Review Convergence Tracker Tests")
class ReviewConvergenceTrackerTest {

    @Test
    @DisplayName("Should flag a review that repeats the previous findings")
    void testObserve_Stuck() {
        // Given
        ReviewConvergenceTracker tracker = new ReviewConvergenceTracker();
        SelfReviewResult same = review(issue("A.java", 1, ReviewIssue.Severity.WARNING, "Missing null check"));

        // When
        Optional<String> first = tracker.observe(1, same);
        Optional<String> second = tracker.observe(2, same);

        // Then
        assertTrue(first.isEmpty());
        assertTrue(second.orElseThrow().startsWith("stuck: 100%"));
    }

    @Test
    @DisplayName("Should flag three critical-free reviews in a row")
    void testObserve_Fatigue() {
        // Given
        ReviewConvergenceTracker tracker = new ReviewConvergenceTracker();

        // When
        Optional<String> first = tracker.observe(1, review(issue("A.java", 1, ReviewIssue.Severity.WARNING, "one")));
        Optional<String> second = tracker.observe(2, review(issue("A.java", 2, ReviewIssue.Severity.WARNING, "two")));
        Optional<String> third = tracker.observe(3, review(issue("A.java", 3, ReviewIssue.Severity.WARNING, "three")));

        // Then
        assertTrue(first.isEmpty());
        assertTrue(second.isEmpty());
        assertEquals("fatigue: 3 reviews in a row without critical issues", third.orElseThrow());
    }

    @Test
    @DisplayName("Should reset the streak when a critical issue appears")
    void testObserve_CriticalResetsStreak() {
        // Given
        ReviewConvergenceTracker tracker = new ReviewConvergenceTracker();
        tracker.observe(1, review(issue("A.java", 1, ReviewIssue.Severity.WARNING, "one")));
        tracker.observe(2, review(issue("A.java", 2, ReviewIssue.Severity.WARNING, "two")));

        // When
        Optional<String> critical = tracker.observe(3, review(issue("A.java", 3, ReviewIssue.Severity.CRITICAL, "boom")));
        Optional<String> after = tracker.observe(4, review(issue("A.java", 4, ReviewIssue.Severity.WARNING, "four")));

        // Then
        assertTrue(critical.isEmpty());
        assertTrue(after.isEmpty());
    }

    @Test
    @DisplayName("Should flag the fifth iteration when it has no critical issue")
    void testObserve_Ceiling() {
        // Given
        ReviewConvergenceTracker tracker = new ReviewConvergenceTracker();

        // When
        Optional<String> reason = tracker.observe(5, review(issue("A.java", 1, ReviewIssue.Severity.WARNING, "x")));

        // Then
        assertEquals("ceiling: iteration 5 without critical issues", reason.orElseThrow());
    }

    @Test
    @DisplayName("Should compare only the first 50 characters of a message")
    void testSignatures_TruncateMessage() {
        // Given
        String prefix = "x".repeat(50);

        // When
        Set<String> signatures = ReviewConvergenceTracker.signatures(List.of(
                issue("A.java", 7, ReviewIssue.Severity.WARNING, prefix + " first ending"),
                issue("A.java", 7, ReviewIssue.Severity.WARNING, prefix + " second ending")));

        // Then
        assertEquals(Set.of("A.java:7:" + prefix), signatures);
    }

    @Test
    @DisplayName("Should measure overlap against the larger set")
    void testOverlap() {
        assertEquals(0.8, ReviewConvergenceTracker.overlap(Set.of("a", "b", "c", "d", "e"), Set.of("a", "b", "c", "d")), 1e-9);
        assertEquals(0.5, ReviewConvergenceTracker.overlap(Set.of("a", "b"), Set.of("a")), 1e-9);
        assertEquals(0.0, ReviewConvergenceTracker.overlap(Set.of(), Set.of()), 1e-9);
    }

    private static SelfReviewResult review(ReviewIssue... issues) {
        return SelfReviewResult.builder().approved(false).issues(List.of(issues)).build();
    }

    private static ReviewIssue issue(String file, int line, ReviewIssue.Severity severity, String message) {
        return ReviewIssue.builder().file(file).line(line).severity(severity).message(message).build();
    }
}
