package com.purchasingpower.fullcycle.workflow.agents;

import com.purchasingpower.fullcycle.service.ProjectFileScanner;
import com.purchasingpower.fullcycle.support.TestFixtures;
import com.purchasingpower.fullcycle.workflow.state.CiFailureType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CI Failure Analyzer Tests")
class CiFailureAnalyzerTest {

    @TempDir
    Path root;

    private final CiFailureAnalyzer analyzer = new CiFailureAnalyzer(new ProjectFileScanner());

    @Test
    @DisplayName("Should classify compilation, test and lint failures")
    void testClassify() {
        assertEquals(CiFailureType.COMPILATION, analyzer.classify("[ERROR] COMPILATION ERROR :"));
        assertEquals(CiFailureType.TEST, analyzer.classify("[ERROR] There are test failures."));
        assertEquals(CiFailureType.LINT, analyzer.classify("[WARN] checkstyle found 3 violations"));
        assertEquals(CiFailureType.UNKNOWN, analyzer.classify("Process completed with exit code 1."));
        assertEquals(CiFailureType.UNKNOWN, analyzer.classify(""));
    }

    @Test
    @DisplayName("Should keep error lines with context and drop timestamps")
    void testExcerpt() {
        // Given
        String logs = """
                2024-05-01T10:00:00.0000000Z step one
                2024-05-01T10:00:00.0000000Z step two
                2024-05-01T10:00:00.0000000Z step three
                2024-05-01T10:00:00.0000000Z step four
                2024-05-01T10:00:00.0000000Z step five
                2024-05-01T10:00:00.0000000Z step six
                2024-05-01T10:00:01.0000000Z [ERROR] cannot find symbol
                2024-05-01T10:00:01.0000000Z done
                """;

        // When
        String excerpt = analyzer.excerpt(logs);

        // Then
        assertEquals("...\nstep five\nstep six\n[ERROR] cannot find symbol\ndone\n", excerpt);
    }

    @Test
    @DisplayName("Should map runner paths to local files by suffix")
    void testCandidateFiles_FromCompilerErrors() {
        // Given
        TestFixtures.write(root, "src/main/java/com/acme/Greeter.java", "class Greeter {}\n");
        String logs = "[ERROR] /home/runner/work/widgets/widgets/src/main/java/com/acme/Greeter.java:[1,1] boom";

        // When
        List<String> candidates = analyzer.candidateFiles(root, logs, List.of("README.md"));

        // Then
        assertEquals(List.of("src/main/java/com/acme/Greeter.java"), candidates);
    }

    @Test
    @DisplayName("Should find failing test sources and fall back to changed files")
    void testCandidateFiles_FromTestsAndFallback() {
        // Given
        TestFixtures.write(root, "src/test/java/com/acme/GreeterTest.java", "class GreeterTest {}\n");

        // When
        List<String> fromTests = analyzer.candidateFiles(root,
                "Tests run: 1, Failures: 1 <<< FAILURE! - in com.acme.GreeterTest", List.of("README.md"));
        List<String> fallback = analyzer.candidateFiles(root, "exit code 1", List.of("README.md"));

        // Then
        assertEquals(List.of("src/test/java/com/acme/GreeterTest.java"), fromTests);
        assertEquals(List.of("README.md"), fallback);
    }
}
