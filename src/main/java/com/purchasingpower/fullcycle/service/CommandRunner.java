package com.purchasingpower.fullcycle.service;

import com.purchasingpower.fullcycle.model.CommandResult;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external program (build tool, test runner, CLI) and captures its combined output.
 */
public interface CommandRunner {

    /**
     * Run {@code argv} in {@code workingDir} and wait for it to exit.
     *
     * <p>Never throws for a failing program: a non-zero exit, a missing executable or a timeout
     * are all reported through {@link CommandResult#exitCode()}.
     *
     * @param timeout the process is killed after this long
     */
    CommandResult run(Path workingDir, List<String> argv, Duration timeout);
}
