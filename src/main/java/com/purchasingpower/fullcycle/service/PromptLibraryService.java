package com.purchasingpower.fullcycle.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.fullcycle.client.LlmMessage;
import com.purchasingpower.fullcycle.client.LlmRequest;
import com.purchasingpower.fullcycle.model.prompt.PromptTemplate;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt Library Service
 *
 * Loads prompts from {@code classpath:prompts/*.yaml} and renders them with Mustache.
 * Templates use triple braces ({@code {{{code}}}}) for source code so nothing gets HTML-escaped.
 *
 * Usage:
 * LlmRequest request = promptLibrary.renderRequest("task-planner", "TaskPlanner", Map.of(
 *     "task", "Add retry to the HTTP client",
 *     "files", fileListing
 * ));
 */
@Slf4j
@Service
public class PromptLibraryService {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:prompts/*.yaml");

            for (Resource resource : resources) {
                PromptTemplate template = yamlMapper.readValue(resource.getInputStream(), PromptTemplate.class);
                templates.put(template.getName(), template);
                log.debug("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
            }

            log.info("Loaded {} prompt templates", templates.size());

        } catch (Exception e) {
            log.error("Failed to load prompt templates", e);
            throw new IllegalStateException("Prompt library initialization failed", e);
        }
    }

    /**
     * Render the user prompt of a template.
     */
    public String render(String templateName, Map<String, Object> variables) {
        PromptTemplate template = getRequiredTemplate(templateName);
        return renderText(templateName + ":user", template.getUserPrompt(), variables);
    }

    /**
     * Render a template into a single-turn LLM request, carrying the template's sampling settings.
     */
    public LlmRequest renderRequest(String templateName, String caller, Map<String, Object> variables) {
        PromptTemplate template = getRequiredTemplate(templateName);
        return LlmRequest.builder()
                .caller(caller)
                .systemPrompt(renderText(templateName + ":system", template.getSystemPrompt(), variables))
                .message(LlmMessage.user(renderText(templateName + ":user", template.getUserPrompt(), variables)))
                .temperature(template.getTemperature())
                .maxTokens(template.getMaxTokens())
                .model(template.getModel())
                .build();
    }

    private String renderText(String name, String text, Map<String, Object> variables) {
        if (text == null) {
            return "";
        }
        Mustache mustache = mustacheFactory.compile(new StringReader(text), name);
        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString();
    }

    private PromptTemplate getRequiredTemplate(String templateName) {
        PromptTemplate template = templates.get(templateName);
        if (template == null) {
            throw new IllegalArgumentException("Prompt template not found: " + templateName);
        }
        return template;
    }

    public PromptTemplate getTemplate(String name) {
        return templates.get(name);
    }
}
