package com.purchasingpower.fullcycle.config;

import com.purchasingpower.fullcycle.client.LlmClient;
import com.purchasingpower.fullcycle.client.LlmClientFactory;
import com.purchasingpower.fullcycle.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Slf4j
@Configuration
public class PipelineBeansConfig {

    /**
     * The provider selected by {@code app.llm.provider}; injected wherever an {@link LlmClient} is needed.
     */
    @Bean
    @Primary
    public LlmClient activeLlmClient(LlmClientFactory factory) {
        LlmClient client = factory.getClient();
        log.info("🚀 LLM provider configured: {}", client.getProviderName());
        return client;
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }
}
