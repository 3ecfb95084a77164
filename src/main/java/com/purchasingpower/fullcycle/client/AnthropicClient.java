package com.purchasingpower.fullcycle.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.purchasingpower.fullcycle.config.LlmProperties;
import com.purchasingpower.fullcycle.exception.LlmException;
import com.purchasingpower.fullcycle.exception.RateLimitException;
import com.purchasingpower.fullcycle.model.CallContext;
import com.purchasingpower.fullcycle.model.ServiceType;
import com.purchasingpower.fullcycle.util.ExternalCallLogger;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.HashMap;
import java.util.Map;

/**
 * Anthropic Messages API client.
 *
 * <p>HTTP 429, and any error body whose type is {@code rate_limit_error}, is reported as a
 * {@link RateLimitException}. No retries happen here; backoff is the caller's decision.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnthropicClient implements LlmClient {

    private final LlmProperties props;
    private final ObjectMapper objectMapper;

    private WebClient webClient;

    @PostConstruct
    public void init() {
        LlmProperties.Anthropic anthropic = props.getAnthropic();
        this.webClient = WebClient.builder()
                .baseUrl(anthropic.getBaseUrl())
                .defaultHeader("x-api-key", anthropic.getApiKey())
                .defaultHeader("anthropic-version", anthropic.getApiVersion())
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build())
                .build();
    }

    @Override
    public String complete(LlmRequest request) {
        Preconditions.checkState(!props.getAnthropic().getApiKey().isBlank(),
                "ANTHROPIC_API_KEY is not configured (app.llm.anthropic.api-key)");

        String model = request.getModel() != null ? request.getModel() : props.getAnthropic().getModel();
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.ANTHROPIC, "messages", log);
        callCtx.logRequest("Generating text",
                "Caller", request.getCaller(),
                "Model", model,
                "Prompt Length", request.promptLength() + " chars");

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("max_tokens", request.getMaxTokens() != null ? request.getMaxTokens() : props.getMaxTokens());
        body.put("temperature", request.getTemperature() != null ? request.getTemperature() : props.getTemperature());
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            body.put("system", request.getSystemPrompt());
        }
        body.put("messages", request.getMessages().stream()
                .map(m -> Map.of("role", m.role(), "content", m.content()))
                .toList());

        try {
            String json = webClient.post()
                    .uri("/v1/messages")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();

            String text = extractText(json);
            callCtx.logResponse("Text generated",
                    "Response Length", text.length() + " chars",
                    "Response", ExternalCallLogger.truncate(text, 500));
            return text;

        } catch (WebClientResponseException e) {
            callCtx.logError(e.getStatusCode() + ": " + e.getMessage(), e);
            if (isRateLimit(e)) {
                throw new RateLimitException("Anthropic rate limit: " + e.getResponseBodyAsString(), e);
            }
            throw new LlmException("Anthropic API call failed for " + request.getCaller()
                    + ": " + e.getStatusCode(), e);
        } catch (LlmException e) {
            callCtx.logError(e.getMessage(), e);
            throw e;
        } catch (Exception e) {
            callCtx.logError("Unexpected error", e);
            throw new LlmException("Anthropic API call failed for " + request.getCaller(), e);
        }
    }

    private String extractText(String json) throws Exception {
        JsonNode root = objectMapper.readTree(json);
        JsonNode content = root.path("content");
        if (!content.isArray() || content.isEmpty()) {
            throw new LlmException("Anthropic response has no content: "
                    + ExternalCallLogger.truncate(json, 300));
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText());
            }
        }
        return text.toString();
    }

    private static boolean isRateLimit(WebClientResponseException e) {
        return e.getStatusCode().value() == 429 || e.getResponseBodyAsString().contains("rate_limit");
    }

    @Override
    public String getProviderName() {
        return "Anthropic";
    }
}
