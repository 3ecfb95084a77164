package com.purchasingpower.fullcycle.exception;

/**
 * Every planned change was skipped or rejected, so there is nothing to commit.
 */
public class NoChangesAppliedException extends PipelineException {

    public NoChangesAppliedException(String message) {
        super(message);
    }
}
