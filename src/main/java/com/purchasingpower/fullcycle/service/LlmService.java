package com.purchasingpower.fullcycle.service;

import com.purchasingpower.fullcycle.client.LlmClient;
import com.purchasingpower.fullcycle.client.LlmRequest;
import com.purchasingpower.fullcycle.config.LlmProperties;
import com.purchasingpower.fullcycle.exception.RateLimitException;
import com.purchasingpower.fullcycle.util.Sleeper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Entry point for every LLM call made by the pipeline.
 *
 * <p>Applies the rate-limit backoff contract: a {@link RateLimitException} is retried after the
 * configured delays (30s, then 60s by default) up to {@code app.llm.rate-limit.max-attempts}
 * total attempts, after which it propagates. Any other exception propagates on the first attempt.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmService {

    private final LlmClient llmClient;
    private final PromptLibraryService promptLibrary;
    private final LlmProperties props;
    private final Sleeper sleeper;

    public String complete(LlmRequest request) {
        LlmProperties.RateLimit rateLimit = props.getRateLimit();
        int maxAttempts = rateLimit.getMaxAttempts();
        List<Duration> backoff = rateLimit.getBackoff();

        for (int attempt = 1; ; attempt++) {
            try {
                return llmClient.complete(request);
            } catch (RateLimitException e) {
                if (attempt >= maxAttempts) {
                    log.error("❌ {} still rate limited after {} attempts", llmClient.getProviderName(), attempt);
                    throw e;
                }
                Duration delay = backoff.get(Math.min(attempt - 1, backoff.size() - 1));
                log.warn("⏳ {} rate limited (caller: {}, attempt {}/{}), retrying in {}s",
                        llmClient.getProviderName(), request.getCaller(), attempt, maxAttempts, delay.toSeconds());
                sleeper.sleep(delay);
            }
        }
    }

    /**
     * Render a prompt template and complete it.
     */
    public String complete(String templateName, String caller, Map<String, Object> variables) {
        return complete(promptLibrary.renderRequest(templateName, caller, variables));
    }
}
