package com.purchasingpower.fullcycle.service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Build tools recognised in a working copy, with the commands used for local validation.
 */
public enum BuildTool {

    MAVEN("pom.xml"),
    GRADLE("build.gradle.kts", "build.gradle");

    private final List<String> markerFiles;

    BuildTool(String... markerFiles) {
        this.markerFiles = List.of(markerFiles);
    }

    public static Optional<BuildTool> detect(Path projectRoot) {
        for (BuildTool tool : values()) {
            if (tool.markerFiles.stream().anyMatch(f -> Files.isRegularFile(projectRoot.resolve(f)))) {
                return Optional.of(tool);
            }
        }
        return Optional.empty();
    }

    public List<String> compileCommand(Path projectRoot) {
        return switch (this) {
            case MAVEN -> List.of("mvn", "-B", "-q", "compile");
            case GRADLE -> List.of(gradleExecutable(projectRoot), "compileJava", "--console=plain");
        };
    }

    public List<String> testCommand(Path projectRoot) {
        return switch (this) {
            case MAVEN -> List.of("mvn", "-B", "test");
            case GRADLE -> List.of(gradleExecutable(projectRoot), "test", "--console=plain");
        };
    }

    private static String gradleExecutable(Path projectRoot) {
        return Files.isRegularFile(projectRoot.resolve("gradlew")) ? "./gradlew" : "gradle";
    }
}
