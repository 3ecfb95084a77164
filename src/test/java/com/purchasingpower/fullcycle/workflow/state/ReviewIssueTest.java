package com.purchasingpower.fullcycle.workflow.state;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Review Issue Severity Tests")
class ReviewIssueTest {

    private Locale originalLocale;

    @BeforeEach
    void setUp() {
        originalLocale = Locale.getDefault();
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(originalLocale);
    }

    @Test
    @DisplayName("Should map severity aliases")
    void testFromString_ShouldMapAliases() {
        assertEquals(ReviewIssue.Severity.CRITICAL, ReviewIssue.Severity.fromString(" blocker "));
        assertEquals(ReviewIssue.Severity.WARNING, ReviewIssue.Severity.fromString("Major"));
        assertEquals(ReviewIssue.Severity.NITPICK, ReviewIssue.Severity.fromString("nit"));
        assertEquals(ReviewIssue.Severity.SUGGESTION, ReviewIssue.Severity.fromString("whatever"));
        assertEquals(ReviewIssue.Severity.SUGGESTION, ReviewIssue.Severity.fromString(null));
    }

    @Test
    @DisplayName("Should parse lowercase severities under a Turkish default locale")
    void testFromString_ShouldIgnoreDefaultLocale() {
        // Given
        Locale.setDefault(new Locale("tr", "TR"));

        // When
        ReviewIssue.Severity critical = ReviewIssue.Severity.fromString("critical");
        ReviewIssue.Severity nitpick = ReviewIssue.Severity.fromString("nitpick");

        // Then
        assertEquals(ReviewIssue.Severity.CRITICAL, critical);
        assertEquals(ReviewIssue.Severity.NITPICK, nitpick);
    }
}
