package com.purchasingpower.fullcycle.exception;

/**
 * Base type of all errors raised by pipeline stages and adapters.
 *
 * <p>{@code recoverable} tells the operator whether a manual retry of the same run can succeed
 * (e.g. a transient hosting error) or whether the inputs must change first.
 */
public class PipelineException extends RuntimeException {

    private final boolean recoverable;

    public PipelineException(String message) {
        this(message, null, false);
    }

    public PipelineException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public PipelineException(String message, Throwable cause, boolean recoverable) {
        super(message, cause);
        this.recoverable = recoverable;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
