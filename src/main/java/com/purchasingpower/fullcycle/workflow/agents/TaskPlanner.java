package com.purchasingpower.fullcycle.workflow.agents;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.fullcycle.exception.LlmException;
import com.purchasingpower.fullcycle.exception.RateLimitException;
import com.purchasingpower.fullcycle.model.ChangeType;
import com.purchasingpower.fullcycle.model.ExecutionPlan;
import com.purchasingpower.fullcycle.model.PlannedChange;
import com.purchasingpower.fullcycle.service.LlmService;
import com.purchasingpower.fullcycle.util.LlmResponseParser;
import com.purchasingpower.fullcycle.util.ProtectedPathMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a task description into an {@link ExecutionPlan}.
 *
 * <p>Never fails because of a bad LLM answer: unparseable output degrades to a single-entry
 * plan. Only a persistent rate limit propagates.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskPlanner {

    static final int MAX_LISTED_FILES = 200;
    static final int MAX_CONTEXT_CHARS = 3_000;
    static final String FALLBACK_SUMMARY = "Plan requires clarification";

    private final LlmService llmService;
    private final ObjectMapper objectMapper;

    public ExecutionPlan plan(String task, String context, List<String> existingFiles) {
        log.info("📋 Planning task: {}", task);
        Set<String> existing = new HashSet<>(existingFiles);

        Map<String, Object> variables = new HashMap<>();
        variables.put("task", task);
        variables.put("context", truncate(context, MAX_CONTEXT_CHARS));
        variables.put("hasContext", context != null && !context.isBlank());
        variables.put("files", String.join("\n", existingFiles.subList(0, Math.min(MAX_LISTED_FILES, existingFiles.size()))));
        variables.put("fileCount", existingFiles.size());

        String response;
        try {
            response = llmService.complete("task-planner", "TaskPlanner", variables);
        } catch (RateLimitException e) {
            throw e;
        } catch (LlmException e) {
            log.warn("⚠️ Planning call failed, using fallback plan: {}", e.getMessage());
            return fallbackPlan(task, existing);
        }

        return parsePlan(task, response, existing).orElseGet(() -> {
            log.warn("⚠️ Could not parse a plan from the LLM response, using fallback plan");
            return fallbackPlan(task, existing);
        });
    }

    Optional<ExecutionPlan> parsePlan(String task, String response, Set<String> existing) {
        Optional<String> json = LlmResponseParser.extractJsonObject(response);
        if (json.isEmpty()) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json.get());
        } catch (Exception e) {
            log.debug("Plan JSON is malformed: {}", e.getMessage());
            return Optional.empty();
        }

        JsonNode entries = root.has("changes") ? root.path("changes") : root.path("plannedChanges");
        Map<String, PlannedChange> changes = new LinkedHashMap<>();
        for (JsonNode entry : entries) {
            String path = ProtectedPathMatcher.normalize(text(entry, "filePath", "path", "file"));
            if (path.isEmpty() || changes.containsKey(path)) {
                continue;
            }
            ChangeType type = ChangeType.fromString(text(entry, "changeType", "action", "type"));
            if (type == null || type == ChangeType.CREATE && existing.contains(path)) {
                type = existing.contains(path) ? ChangeType.MODIFY : ChangeType.CREATE;
            }
            changes.put(path, PlannedChange.builder()
                    .filePath(path)
                    .changeType(type)
                    .description(text(entry, "description", "reason"))
                    .build());
        }

        if (changes.isEmpty()) {
            return Optional.empty();
        }

        List<PlannedChange> planned = new ArrayList<>(changes.values());
        String summary = root.path("summary").asText("");
        int estimated = root.path("estimatedFilesCount").asInt(planned.size());
        log.info("✅ Plan ready: {} changes", planned.size());
        return Optional.of(new ExecutionPlan(task, planned, estimated, summary.isBlank() ? task : summary));
    }

    /**
     * One-entry plan: modify an existing file the task mentions, otherwise README.md.
     */
    ExecutionPlan fallbackPlan(String task, Set<String> existing) {
        String mentioned = existing.stream()
                .filter(path -> task.contains(path) || task.contains(fileName(path)) && fileName(path).contains("."))
                .findFirst()
                .orElse(null);

        PlannedChange change;
        if (mentioned != null) {
            change = PlannedChange.builder().filePath(mentioned).changeType(ChangeType.MODIFY).description(task).build();
        } else {
            change = PlannedChange.builder()
                    .filePath("README.md")
                    .changeType(existing.contains("README.md") ? ChangeType.MODIFY : ChangeType.CREATE)
                    .description(task)
                    .build();
        }
        return new ExecutionPlan(task, List.of(change), 1, FALLBACK_SUMMARY);
    }

    private static String text(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }

    private static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxChars ? text : text.substring(0, maxChars) + "\n... (truncated)";
    }
}
