package com.purchasingpower.fullcycle.exception;

public class VersionControlException extends PipelineException {

    public VersionControlException(String message) {
        super(message);
    }

    public VersionControlException(String message, Throwable cause) {
        super(message, cause);
    }
}
