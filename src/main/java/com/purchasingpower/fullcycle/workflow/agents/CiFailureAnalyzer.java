package com.purchasingpower.fullcycle.workflow.agents;

import com.purchasingpower.fullcycle.service.ProjectFileScanner;
import com.purchasingpower.fullcycle.util.CompilerOutputParser;
import com.purchasingpower.fullcycle.util.ProtectedPathMatcher;
import com.purchasingpower.fullcycle.workflow.state.CiFailureType;
import com.purchasingpower.fullcycle.workflow.state.CompilationError;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reads CI logs: what kind of failure, which lines matter, which files to fix.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CiFailureAnalyzer {

    static final int MAX_EXCERPT_CHARS = 6_000;
    static final int MAX_CANDIDATE_FILES = 5;
    private static final int CONTEXT_LINES = 2;

    private static final Pattern COMPILATION = Pattern.compile(
            "COMPILATION ERROR|cannot find symbol|Compilation failed|compileJava FAILED|compileKotlin FAILED"
                    + "|: error: |^e: |incompatible types|\\[ERROR] .*\\.java:\\[\\d+",
            Pattern.MULTILINE);
    private static final Pattern TEST = Pattern.compile(
            "There are test failures|Tests run: \\d+, Failures: [1-9]|Tests run: \\d+, Failures: \\d+, Errors: [1-9]"
                    + "|<<< FAILURE!|tests completed, \\d+ failed|> \\S+ FAILED|AssertionError|AssertionFailedError");
    private static final Pattern LINT = Pattern.compile(
            "checkstyle|spotless|ktlint|detekt|eslint|pmd|lint", Pattern.CASE_INSENSITIVE);
    private static final Pattern SIGNIFICANT_LINE = Pattern.compile(
            "error|fail|exception|expected|cannot find|violation", Pattern.CASE_INSENSITIVE);

    private final ProjectFileScanner fileScanner;

    public CiFailureType classify(String logs) {
        if (logs == null || logs.isBlank()) {
            return CiFailureType.UNKNOWN;
        }
        if (COMPILATION.matcher(logs).find()) {
            return CiFailureType.COMPILATION;
        }
        if (TEST.matcher(logs).find()) {
            return CiFailureType.TEST;
        }
        if (LINT.matcher(logs).find()) {
            return CiFailureType.LINT;
        }
        return CiFailureType.UNKNOWN;
    }

    /**
     * Lines around error markers, bounded in size; the log tail when no marker is found.
     */
    public String excerpt(String logs) {
        if (logs == null || logs.isBlank()) {
            return "";
        }
        List<String> lines = logs.lines().map(CiFailureAnalyzer::stripTimestamp).toList();
        Set<Integer> keep = new LinkedHashSet<>();
        for (int i = 0; i < lines.size(); i++) {
            if (SIGNIFICANT_LINE.matcher(lines.get(i)).find()) {
                for (int j = Math.max(0, i - CONTEXT_LINES); j <= Math.min(lines.size() - 1, i + CONTEXT_LINES); j++) {
                    keep.add(j);
                }
            }
        }

        if (keep.isEmpty()) {
            return tail(logs, MAX_EXCERPT_CHARS);
        }

        StringBuilder excerpt = new StringBuilder();
        int previous = -2;
        for (int index : keep) {
            if (index != previous + 1) {
                excerpt.append("...\n");
            }
            excerpt.append(lines.get(index)).append('\n');
            previous = index;
            if (excerpt.length() >= MAX_EXCERPT_CHARS) {
                break;
            }
        }
        return excerpt.length() > MAX_EXCERPT_CHARS ? excerpt.substring(0, MAX_EXCERPT_CHARS) : excerpt.toString();
    }

    /**
     * Files to hand to the fixer: those named in compiler errors or failing tests, else the
     * files the run changed.
     */
    public List<String> candidateFiles(Path projectRoot, String logs, Collection<String> changedFiles) {
        Set<String> candidates = new LinkedHashSet<>();
        String cleaned = logs == null ? "" : logs.lines()
                .map(CiFailureAnalyzer::stripTimestamp)
                .collect(Collectors.joining("\n"));
        for (CompilationError error : CompilerOutputParser.parseCompilationErrors(cleaned)) {
            if (error.getFile() == null) {
                continue;
            }
            String reported = ChangeApplier.toProjectPath(projectRoot, error.getFile())
                    .orElse(ProtectedPathMatcher.normalize(error.getFile()));
            resolveCiPath(projectRoot, reported).ifPresent(candidates::add);
        }
        for (String testClass : CompilerOutputParser.parseFailedTests(cleaned)) {
            fileScanner.findClassSource(projectRoot, testClass).ifPresent(candidates::add);
        }
        if (candidates.isEmpty()) {
            candidates.addAll(changedFiles);
        }
        List<String> result = new ArrayList<>(candidates);
        return result.size() > MAX_CANDIDATE_FILES ? result.subList(0, MAX_CANDIDATE_FILES) : result;
    }

    /**
     * CI runners check out into their own directory, so an absolute path from the log has a
     * foreign prefix; match it to a local file by its longest existing suffix.
     */
    private Optional<String> resolveCiPath(Path projectRoot, String path) {
        String[] parts = path.split("/");
        for (int start = 0; start < parts.length; start++) {
            String suffix = String.join("/", Arrays.copyOfRange(parts, start, parts.length));
            if (Files.isRegularFile(projectRoot.resolve(suffix))) {
                return Optional.of(suffix);
            }
        }
        return Optional.empty();
    }

    private static String stripTimestamp(String line) {
        // GitHub Actions prefixes every line with an ISO timestamp
        return line.length() > 29 && line.charAt(4) == '-' && line.charAt(10) == 'T'
                ? line.substring(line.indexOf(' ') + 1)
                : line;
    }

    private static String tail(String text, int maxChars) {
        return text.length() <= maxChars ? text : text.substring(text.length() - maxChars);
    }
}
