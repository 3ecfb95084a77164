package com.purchasingpower.fullcycle.client;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Provider-neutral completion request.
 *
 * <p>{@code temperature}, {@code maxTokens} and {@code model} may be left {@code null}; the
 * provider then applies the defaults from {@code app.llm}.
 */
@Value
@Builder(toBuilder = true)
public class LlmRequest {

    /**
     * Name of the calling component, used only for logging.
     */
    String caller;

    String systemPrompt;

    @Singular
    List<LlmMessage> messages;

    Double temperature;

    Integer maxTokens;

    String model;

    public int promptLength() {
        int length = systemPrompt == null ? 0 : systemPrompt.length();
        for (LlmMessage message : messages) {
            length += message.content() == null ? 0 : message.content().length();
        }
        return length;
    }
}
