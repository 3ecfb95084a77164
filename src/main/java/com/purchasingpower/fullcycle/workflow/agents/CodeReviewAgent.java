package com.purchasingpower.fullcycle.workflow.agents;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.fullcycle.exception.ReviewServiceException;
import com.purchasingpower.fullcycle.service.LlmService;
import com.purchasingpower.fullcycle.service.ReviewService;
import com.purchasingpower.fullcycle.util.LlmResponseParser;
import com.purchasingpower.fullcycle.workflow.state.ReviewIssue;
import com.purchasingpower.fullcycle.workflow.state.SelfReviewResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * LLM-backed {@link ReviewService}: reviews a pull request diff against the task.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CodeReviewAgent implements ReviewService {

    static final int MAX_DIFF_CHARS = 30_000;

    private final LlmService llmService;
    private final ObjectMapper objectMapper;

    @Override
    public SelfReviewResult review(String taskDescription, String diff) {
        log.info("👀 Reviewing pull request diff ({} chars)...", diff == null ? 0 : diff.length());

        Map<String, Object> variables = new HashMap<>();
        variables.put("task", taskDescription);
        variables.put("diff", diff == null || diff.length() <= MAX_DIFF_CHARS
                ? diff : diff.substring(0, MAX_DIFF_CHARS) + "\n... (diff truncated)");

        String response;
        try {
            response = llmService.complete("code-review", "CodeReviewAgent", variables);
        } catch (RuntimeException e) {
            throw new ReviewServiceException("Review call failed: " + e.getMessage(), e);
        }

        SelfReviewResult result = parse(response);
        log.info("✅ Review complete. Approved: {}, Issues: {} (critical: {}, warnings: {})",
                result.isApproved(), result.getIssues().size(),
                result.countOf(ReviewIssue.Severity.CRITICAL), result.countOf(ReviewIssue.Severity.WARNING));
        return result;
    }

    SelfReviewResult parse(String response) {
        String json = LlmResponseParser.extractJsonObject(response)
                .orElseThrow(() -> new ReviewServiceException("Review response contains no JSON object", null));

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new ReviewServiceException("Review response is not valid JSON", e);
        }

        SelfReviewResult.SelfReviewResultBuilder builder = SelfReviewResult.builder()
                .approved(root.path("approved").asBoolean(false))
                .overallAssessment(root.path("overallAssessment").asText(root.path("summary").asText("")));

        for (JsonNode node : root.path("issues")) {
            JsonNode line = node.path("line");
            builder.issue(ReviewIssue.builder()
                    .file(node.path("file").asText(""))
                    .line(line.canConvertToInt() && line.asInt() > 0 ? line.asInt() : null)
                    .severity(ReviewIssue.Severity.fromString(node.path("severity").asText(null)))
                    .message(node.path("message").asText(node.path("description").asText("")))
                    .suggestedFix(node.hasNonNull("suggestedFix") ? node.path("suggestedFix").asText() : null)
                    .build());
        }
        return builder.build();
    }
}
