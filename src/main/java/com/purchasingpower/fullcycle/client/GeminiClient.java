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
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini {@code generateContent} client.
 *
 * <p>The API key travels in the {@code x-goog-api-key} header rather than the query string, so
 * it never shows up in access or proxy logs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeminiClient implements LlmClient {

    private final LlmProperties props;
    private final ObjectMapper objectMapper;

    private WebClient geminiWebClient;

    @PostConstruct
    public void init() {
        this.geminiWebClient = WebClient.builder()
                .baseUrl(props.getGemini().getBaseUrl())
                .defaultHeader("x-goog-api-key", props.getGemini().getApiKey())
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build())
                .build();
    }

    private String getApiUrl(String model) {
        return String.format("/%s/models/%s:generateContent", props.getGemini().getApiVersion(), model);
    }

    @Override
    public String complete(LlmRequest request) {
        Preconditions.checkState(!props.getGemini().getApiKey().isBlank(),
                "GEMINI_KEY is not configured (app.llm.gemini.api-key)");

        String model = request.getModel() != null ? request.getModel() : props.getGemini().getModel();
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GEMINI, "generateContent", log);
        callCtx.logRequest("Generating text",
                "Caller", request.getCaller(),
                "Model", model,
                "Prompt Length", request.promptLength() + " chars");

        Map<String, Object> body = new HashMap<>();
        // Gemini calls the assistant role "model"
        body.put("contents", request.getMessages().stream()
                .map(m -> Map.of(
                        "role", "assistant".equals(m.role()) ? "model" : "user",
                        "parts", List.of(Map.of("text", m.content()))))
                .toList());
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            body.put("systemInstruction", Map.of("parts", List.of(Map.of("text", request.getSystemPrompt()))));
        }
        body.put("generationConfig", Map.of(
                "temperature", request.getTemperature() != null ? request.getTemperature() : props.getTemperature(),
                "maxOutputTokens", request.getMaxTokens() != null ? request.getMaxTokens() : props.getMaxTokens()));

        try {
            String json = geminiWebClient.post().uri(getApiUrl(model)).bodyValue(body)
                    .retrieve().bodyToMono(String.class)
                    .block();

            JsonNode root = objectMapper.readTree(json);
            JsonNode parts = root.path("candidates").path(0).path("content").path("parts");
            if (!parts.isArray() || parts.isEmpty()) {
                throw new LlmException("Gemini response has no candidates: "
                        + ExternalCallLogger.truncate(json, 300));
            }
            StringBuilder text = new StringBuilder();
            parts.forEach(part -> text.append(part.path("text").asText()));

            JsonNode usage = root.path("usageMetadata");
            callCtx.logResponse("Text generated",
                    "Tokens", usage.path("promptTokenCount").asInt(0) + " in + "
                            + usage.path("candidatesTokenCount").asInt(0) + " out",
                    "Response", ExternalCallLogger.truncate(text.toString(), 500));
            return text.toString();

        } catch (WebClientResponseException e) {
            callCtx.logError(e.getStatusCode() + ": " + e.getMessage(), e);
            if (e.getStatusCode().value() == 429 || e.getResponseBodyAsString().contains("RESOURCE_EXHAUSTED")) {
                throw new RateLimitException("Gemini rate limit: " + e.getStatusCode(), e);
            }
            throw new LlmException("Gemini API call failed for " + request.getCaller() + ": " + e.getStatusCode(), e);
        } catch (LlmException e) {
            callCtx.logError(e.getMessage(), e);
            throw e;
        } catch (Exception e) {
            callCtx.logError("Unexpected error", e);
            throw new LlmException("Gemini API call failed for " + request.getCaller(), e);
        }
    }

    @Override
    public String getProviderName() {
        return "Gemini";
    }
}
