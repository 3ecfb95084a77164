package com.purchasingpower.fullcycle.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * LLM provider configuration ({@code app.llm}).
 *
 * <p>Example configuration:
 * <pre>
 * app:
 *   llm:
 *     provider: anthropic
 *     temperature: 0.3
 *     max-tokens: 4096
 *     anthropic:
 *       api-key: ${ANTHROPIC_API_KEY:}
 *       model: claude-sonnet-4-20250514
 *     gemini:
 *       api-key: ${GEMINI_KEY:}
 *       model: gemini-1.5-pro
 *     rate-limit:
 *       max-attempts: 3
 *       backoff: 30s, 60s
 * </pre>
 *
 * <p><b>Rate limits:</b> only a rate-limit response is retried, waiting
 * {@code backoff[n]} before attempt {@code n + 2}; the last delay repeats if the list is shorter
 * than {@code max-attempts - 1}. Every other failure surfaces on the first attempt.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.llm")
public class LlmProperties {

    /**
     * Active provider: "anthropic" or "gemini".
     */
    @NotBlank
    private String provider = "anthropic";

    private double temperature = 0.3;

    @Min(256)
    private int maxTokens = 4096;

    @Valid
    @NotNull
    private Anthropic anthropic = new Anthropic();

    @Valid
    @NotNull
    private Gemini gemini = new Gemini();

    @Valid
    @NotNull
    private RateLimit rateLimit = new RateLimit();

    @Data
    public static class Anthropic {
        private String apiKey = "";

        @NotBlank
        private String model = "claude-sonnet-4-20250514";

        @NotBlank
        private String baseUrl = "https://api.anthropic.com";

        @NotBlank
        private String apiVersion = "2023-06-01";
    }

    @Data
    public static class Gemini {
        private String apiKey = "";

        @NotBlank
        private String model = "gemini-1.5-pro";

        @NotBlank
        private String baseUrl = "https://generativelanguage.googleapis.com";

        @NotBlank
        private String apiVersion = "v1beta";
    }

    @Data
    public static class RateLimit {
        @Min(1)
        private int maxAttempts = 3;

        @NotEmpty
        private List<Duration> backoff = new ArrayList<>(List.of(Duration.ofSeconds(30), Duration.ofSeconds(60)));
    }
}
