package com.purchasingpower.fullcycle.client;

/**
 * Unified interface for LLM providers (Anthropic, Gemini).
 *
 * Implementations handle provider-specific API details and must report a rate-limit refusal
 * as {@link com.purchasingpower.fullcycle.exception.RateLimitException} so callers can back off;
 * every other failure is a plain {@link com.purchasingpower.fullcycle.exception.LlmException}.
 */
public interface LlmClient {

    /**
     * Execute one completion.
     *
     * @param request system prompt, conversation and sampling settings
     * @return the response text
     */
    String complete(LlmRequest request);

    /**
     * Get the provider name (for logging).
     */
    String getProviderName();
}
