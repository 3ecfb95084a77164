package com.purchasingpower.fullcycle.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.fullcycle.config.LlmProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LLM Client Factory Tests")
class LlmClientFactoryTest {

    private LlmProperties props;
    private LlmClientFactory factory;

    @BeforeEach
    void setUp() {
        props = new LlmProperties();
        ObjectMapper mapper = new ObjectMapper();
        factory = new LlmClientFactory(new AnthropicClient(props, mapper), new GeminiClient(props, mapper), props);
    }

    @Test
    @DisplayName("Should select Anthropic by default")
    void testGetClient_ShouldDefaultToAnthropic() {
        assertEquals("Anthropic", factory.getClient().getProviderName());
    }

    @Test
    @DisplayName("Should select Gemini regardless of case")
    void testGetClient_ShouldSelectGemini() {
        // Given
        props.setProvider("Gemini");

        // When
        LlmClient client = factory.getClient();

        // Then
        assertInstanceOf(GeminiClient.class, client);
    }

    @Test
    @DisplayName("Should accept 'claude' as an alias")
    void testGetClient_ShouldAcceptClaudeAlias() {
        props.setProvider("claude");

        assertInstanceOf(AnthropicClient.class, factory.getClient());
    }

    @Test
    @DisplayName("Should fall back to Anthropic for an unknown provider")
    void testGetClient_ShouldFallBackOnUnknownProvider() {
        props.setProvider("mystery");

        assertInstanceOf(AnthropicClient.class, factory.getClient());
    }
}
