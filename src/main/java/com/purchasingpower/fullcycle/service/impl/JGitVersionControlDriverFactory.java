package com.purchasingpower.fullcycle.service.impl;

import com.purchasingpower.fullcycle.config.GitHubProperties;
import com.purchasingpower.fullcycle.exception.VersionControlException;
import com.purchasingpower.fullcycle.service.VersionControlDriver;
import com.purchasingpower.fullcycle.service.VersionControlDriverFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;

@Slf4j
@Service
@RequiredArgsConstructor
public class JGitVersionControlDriverFactory implements VersionControlDriverFactory {

    private final GitHubProperties gitHubProperties;

    @Override
    public VersionControlDriver open(Path repositoryRoot) {
        try {
            Git git = Git.open(repositoryRoot.toFile());
            log.debug("Opened git repository at {}", repositoryRoot);
            return new JGitVersionControlDriver(git, credentials());
        } catch (IOException e) {
            throw new VersionControlException("Not a git repository: " + repositoryRoot, e);
        }
    }

    private CredentialsProvider credentials() {
        String token = gitHubProperties.getToken();
        if (token == null || token.isBlank()) {
            return null; // SSH agent or credential-free remotes
        }
        return new UsernamePasswordCredentialsProvider(gitHubProperties.getUsername(), token);
    }
}
