package com.purchasingpower.fullcycle.exception;

/**
 * Any LLM provider failure other than a rate limit.
 */
public class LlmException extends PipelineException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
