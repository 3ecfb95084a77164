package com.purchasingpower.fullcycle.util;

import com.purchasingpower.fullcycle.workflow.state.CompilationError;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses compiler diagnostics and failing tests out of Maven, Gradle/javac and Kotlin output.
 */
public final class CompilerOutputParser {

    // [ERROR] /repo/src/main/java/a/B.java:[12,8] cannot find symbol
    private static final Pattern MAVEN_ERROR = Pattern.compile(
            "^\\[ERROR]\\s+(?:COMPILATION ERROR\\s*:?\\s*)?(\\S+?\\.\\w+):\\[(\\d+)(?:,\\d+)?]\\s*(.+)$");

    // src/main/java/a/B.java:12: error: cannot find symbol
    private static final Pattern JAVAC_ERROR = Pattern.compile(
            "^(\\S+?\\.(?:java|kt|scala|groovy)):(\\d+):\\s*error:\\s*(.+)$");

    // e: file:///repo/src/main/kotlin/A.kt:12:5 Unresolved reference: foo
    private static final Pattern KOTLIN_ERROR = Pattern.compile(
            "^e:\\s+(?:file://)?(\\S+?\\.kts?):(\\d+):\\d+\\s+(.+)$");

    // [ERROR] some message without a location
    private static final Pattern GENERIC_MAVEN_ERROR = Pattern.compile("^\\[ERROR]\\s+(.+)$");

    // Tests run: 3, Failures: 1, ... <<< FAILURE! - in com.acme.CalculatorTest
    private static final Pattern SUREFIRE_FAILURE = Pattern.compile(
            "<<< (?:FAILURE|ERROR)!\\s*-+\\s*in\\s+([\\w.$]+)");

    // CalculatorTest > addsNumbers() FAILED
    private static final Pattern GRADLE_TEST_FAILURE = Pattern.compile("^([\\w.$]+)\\s+>\\s+.+\\sFAILED$");

    private CompilerOutputParser() {
    }

    /**
     * Diagnostics that point at a source location, in output order, without duplicates.
     * When none can be located, Maven's bare {@code [ERROR]} lines are returned without a file
     * so that a failing build never yields an empty list.
     */
    public static List<CompilationError> parseCompilationErrors(String output) {
        List<CompilationError> located = new ArrayList<>();
        List<CompilationError> unlocated = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        if (output == null) {
            return located;
        }

        for (String rawLine : output.lines().toList()) {
            String line = rawLine.strip();
            CompilationError error = matchLocated(line);
            if (error != null) {
                if (seen.add(error.format())) {
                    located.add(error);
                }
                continue;
            }
            Matcher generic = GENERIC_MAVEN_ERROR.matcher(line);
            if (generic.matches()) {
                String message = generic.group(1).trim();
                if (!isMavenNoise(message) && seen.add(message)) {
                    unlocated.add(CompilationError.builder().message(message).build());
                }
            }
        }
        return located.isEmpty() ? unlocated : located;
    }

    private static CompilationError matchLocated(String line) {
        for (Pattern pattern : List.of(MAVEN_ERROR, JAVAC_ERROR, KOTLIN_ERROR)) {
            Matcher m = pattern.matcher(line);
            if (m.matches()) {
                return CompilationError.builder()
                        .file(m.group(1))
                        .line(Integer.parseInt(m.group(2)))
                        .message(m.group(3).trim())
                        .build();
            }
        }
        return null;
    }

    private static boolean isMavenNoise(String message) {
        return message.isEmpty()
                || message.contains("Failed to execute goal")
                || message.contains("To see the full stack trace")
                || message.contains("Re-run Maven")
                || message.contains("For more information about the errors")
                || message.startsWith("->")
                || message.startsWith("[Help");
    }

    /**
     * Fully qualified (Surefire) or simple (Gradle) names of failing test classes.
     */
    public static List<String> parseFailedTests(String output) {
        Set<String> failed = new LinkedHashSet<>();
        if (output == null) {
            return List.of();
        }
        for (String rawLine : output.lines().toList()) {
            String line = rawLine.strip();
            Matcher surefire = SUREFIRE_FAILURE.matcher(line);
            if (surefire.find()) {
                failed.add(surefire.group(1));
                continue;
            }
            Matcher gradle = GRADLE_TEST_FAILURE.matcher(line);
            if (gradle.matches()) {
                failed.add(gradle.group(1));
            }
        }
        return List.copyOf(failed);
    }
}
