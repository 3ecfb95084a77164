package com.purchasingpower.fullcycle.service;

import com.purchasingpower.fullcycle.exception.PipelineException;
import com.purchasingpower.fullcycle.util.ProtectedPathMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Lists the source tree of a working copy, skipping VCS metadata and build output.
 */
@Slf4j
@Service
public class ProjectFileScanner {

    private static final Set<String> SKIPPED_DIRECTORIES =
            Set.of(".git", ".idea", ".gradle", ".mvn", "target", "build", "out", "node_modules");

    /**
     * Relative paths ('/' separated) of every regular file, sorted.
     */
    public List<String> listFiles(Path root) {
        List<String> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && SKIPPED_DIRECTORIES.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        files.add(ProtectedPathMatcher.normalize(root.relativize(file).toString()));
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new PipelineException("Failed to scan project files under " + root, e);
        }
        Collections.sort(files);
        log.debug("Scanned {} files under {}", files.size(), root);
        return files;
    }

    /**
     * Source file of a fully qualified class name, e.g. {@code com.acme.FooTest} to
     * {@code src/test/java/com/acme/FooTest.java}.
     */
    public Optional<String> findClassSource(Path root, String className) {
        String suffix = "/" + className.replace('.', '/');
        return listFiles(root).stream()
                .filter(f -> f.endsWith(suffix + ".java") || f.endsWith(suffix + ".kt"))
                .findFirst();
    }
}
