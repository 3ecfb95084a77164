package com.purchasingpower.fullcycle.client;

import com.purchasingpower.fullcycle.config.LlmProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Selects the active LLM provider from {@code app.llm.provider}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmClientFactory {

    private final AnthropicClient anthropicClient;
    private final GeminiClient geminiClient;
    private final LlmProperties props;

    public LlmClient getClient() {
        return switch (props.getProvider().toLowerCase(Locale.ROOT)) {
            case "anthropic", "claude" -> anthropicClient;
            case "gemini" -> geminiClient;
            default -> {
                log.warn("Unknown LLM provider: {}, falling back to Anthropic", props.getProvider());
                yield anthropicClient;
            }
        };
    }
}
