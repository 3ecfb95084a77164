package com.purchasingpower.fullcycle.service;

import java.nio.file.Path;

/**
 * Opens a {@link VersionControlDriver} for a working copy.
 */
public interface VersionControlDriverFactory {

    VersionControlDriver open(Path repositoryRoot);
}
