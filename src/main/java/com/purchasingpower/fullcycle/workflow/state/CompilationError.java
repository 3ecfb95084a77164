package com.purchasingpower.fullcycle.workflow.state;

import lombok.Builder;
import lombok.Value;

/**
 * A single compiler diagnostic parsed from build output.
 */
@Value
@Builder
public class CompilationError {

    /**
     * Source file as printed by the compiler; may be absolute. {@code null} when the
     * diagnostic is not tied to a file.
     */
    String file;

    /**
     * 1-based line, or 0 when unknown.
     */
    int line;

    String message;

    public String format() {
        return (file == null ? "" : file + ":" + line + ": ") + message;
    }
}
