package com.purchasingpower.fullcycle.service.git;

import com.purchasingpower.fullcycle.model.RepositoryCoordinates;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * URL parser for GitHub remotes.
 *
 * Handles:
 * - https://github.com/owner/repo
 * - https://github.com/owner/repo.git
 * - https://token@github.com/owner/repo.git
 * - git@github.com:owner/repo.git
 * - ssh://git@github.com/owner/repo
 */
public final class GitHubUrlParser {

    private static final Pattern GITHUB_REMOTE = Pattern.compile("github\\.com[:/]([^/]+)/([^/]+?)(?:\\.git)?/?$");

    private GitHubUrlParser() {
    }

    public static Optional<RepositoryCoordinates> parse(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        Matcher m = GITHUB_REMOTE.matcher(url.trim());
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new RepositoryCoordinates(m.group(1), m.group(2)));
    }
}
