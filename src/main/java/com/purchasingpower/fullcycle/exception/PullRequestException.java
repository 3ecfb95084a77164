package com.purchasingpower.fullcycle.exception;

/**
 * The hosting platform rejected or failed a pull request operation.
 */
public class PullRequestException extends PipelineException {

    public PullRequestException(String message) {
        super(message, null, true);
    }

    public PullRequestException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
