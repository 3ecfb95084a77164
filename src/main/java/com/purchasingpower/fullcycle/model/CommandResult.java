package com.purchasingpower.fullcycle.model;

/**
 * Outcome of an external command: combined stdout/stderr and the exit status.
 */
public record CommandResult(int exitCode, String output, long durationMs) {

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
