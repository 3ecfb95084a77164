package com.purchasingpower.fullcycle.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Prompt template loaded from YAML configuration.
 *
 * YAML structure:
 * <pre>
 * name: task-planner
 * version: 1.0
 * temperature: 0.3
 * maxTokens: 4096
 * systemPrompt: |
 *   You are an expert...
 * userPrompt: |
 *   Plan this task...
 * </pre>
 *
 * {@code model}, {@code temperature} and {@code maxTokens} are optional; the provider
 * defaults from {@code app.llm} apply when they are absent.
 *
 * @see com.purchasingpower.fullcycle.service.PromptLibraryService
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String model;
    private Double temperature;
    private Integer maxTokens;
    private String systemPrompt;
    private String userPrompt;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public Double getTemperature() {
        return temperature;
    }

    public void setTemperature(Double temperature) {
        this.temperature = temperature;
    }

    public Integer getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(Integer maxTokens) {
        this.maxTokens = maxTokens;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public String getUserPrompt() {
        return userPrompt;
    }

    public void setUserPrompt(String userPrompt) {
        this.userPrompt = userPrompt;
    }
}
