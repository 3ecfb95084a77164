package com.purchasingpower.fullcycle.util;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether a project-relative path must never be written or deleted by the pipeline
 * (secrets, keys, env files).
 *
 * <p>Patterns are globs unless prefixed with {@code regex:}. A glob without '/' is matched
 * against the file name, so {@code *.pem} protects {@code certs/server.pem}; a glob with '/'
 * is matched against the whole path, and {@code **&#47;secrets/**} also matches a top-level
 * {@code secrets/} directory. Paths escaping the project root are always protected.
 */
public class ProtectedPathMatcher {

    private final List<PathMatcher> nameMatchers = new ArrayList<>();
    private final List<PathMatcher> pathMatchers = new ArrayList<>();
    private final List<Pattern> regexes = new ArrayList<>();

    public ProtectedPathMatcher(List<String> patterns) {
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                continue;
            }
            if (pattern.startsWith("regex:")) {
                regexes.add(Pattern.compile(pattern.substring("regex:".length())));
            } else if (pattern.contains("/")) {
                pathMatchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
            } else {
                nameMatchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
            }
        }
    }

    public boolean isProtected(String relativePath) {
        String normalized = normalize(relativePath);
        if (normalized.isEmpty() || escapesRoot(normalized)) {
            return true;
        }

        Path fileName = Path.of(normalized).getFileName();
        for (PathMatcher matcher : nameMatchers) {
            if (fileName != null && matcher.matches(fileName)) {
                return true;
            }
        }
        for (PathMatcher matcher : pathMatchers) {
            if (matcher.matches(Path.of(normalized)) || matcher.matches(Path.of("/" + normalized))) {
                return true;
            }
        }
        for (Pattern regex : regexes) {
            if (regex.matcher(normalized).matches()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Forward slashes, no leading "./" or "/".
     */
    public static String normalize(String path) {
        if (path == null) {
            return "";
        }
        String normalized = path.trim().replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        return normalized;
    }

    private static boolean escapesRoot(String normalized) {
        return normalized.equals("..") || normalized.startsWith("../") || normalized.contains("/../")
                || normalized.endsWith("/..") || normalized.matches("^[A-Za-z]:.*");
    }
}
