package com.purchasingpower.fullcycle.exception;

import lombok.Getter;

/**
 * The project still does not compile after the local fix budget was spent.
 * The working tree has already been reverted when this is thrown.
 */
@Getter
public class CompilationFailedException extends PipelineException {

    private final String errorLogs;

    public CompilationFailedException(String message, String errorLogs) {
        super(message);
        this.errorLogs = errorLogs;
    }
}
