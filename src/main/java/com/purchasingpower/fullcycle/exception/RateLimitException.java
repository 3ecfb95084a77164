package com.purchasingpower.fullcycle.exception;

/**
 * The LLM provider refused the call because of a rate limit. The only LLM failure that is
 * retried with backoff.
 */
public class RateLimitException extends LlmException {

    public RateLimitException(String message) {
        super(message);
    }

    public RateLimitException(String message, Throwable cause) {
        super(message, cause);
    }
}
