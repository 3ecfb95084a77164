package com.purchasingpower.fullcycle.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class MergeConflictException extends PipelineException {

    private final List<String> conflictingFiles;

    public MergeConflictException(String message, List<String> conflictingFiles) {
        super(message, null, true);
        this.conflictingFiles = List.copyOf(conflictingFiles);
    }

    public MergeConflictException(String message, List<String> conflictingFiles, Throwable cause) {
        super(message, cause, true);
        this.conflictingFiles = List.copyOf(conflictingFiles);
    }
}
