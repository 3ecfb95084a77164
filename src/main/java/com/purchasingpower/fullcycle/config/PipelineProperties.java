package com.purchasingpower.fullcycle.config;

import com.purchasingpower.fullcycle.model.MergeMethod;
import com.purchasingpower.fullcycle.model.PipelineConfig;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Defaults for every pipeline run, bound from the {@code app.pipeline} namespace.
 *
 * <p>Example configuration:
 * <pre>
 * app:
 *   pipeline:
 *     max-review-iterations: 10
 *     max-ci-retries: 5
 *     max-compilation-attempts: 3
 *     max-test-attempts: 2
 *     auto-merge: true
 *     require-ci-pass: true
 *     force-approve-enabled: false
 *     keep-ours-on-conflict: false
 *     ci-poll-interval: 15s
 *     ci-wait-window: 10m
 *     protected-patterns:
 *       - ".env"
 *       - "**&#47;secrets/**"
 * </pre>
 *
 * <p>The values are copied into an immutable {@link PipelineConfig} when a run starts, so a
 * running pipeline never observes a later change.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {

    @Min(1)
    @Max(50)
    private int maxReviewIterations = 10;

    @Min(1)
    @Max(20)
    private int maxCiRetries = 5;

    @Min(1)
    @Max(10)
    private int maxCompilationAttempts = 3;

    @Min(1)
    @Max(10)
    private int maxTestAttempts = 2;

    private boolean autoMerge = true;

    private boolean requireCiPass = true;

    private boolean runLocalTests = true;

    private boolean forceApproveEnabled = false;

    private boolean keepOursOnConflict = false;

    private boolean deleteBranchAfterMerge = true;

    @NotBlank
    private String baseBranch = "main";

    @NotNull
    private MergeMethod mergeMethod = MergeMethod.SQUASH;

    @NotNull
    private Duration ciPollInterval = Duration.ofSeconds(15);

    @NotNull
    private Duration ciWaitWindow = Duration.ofMinutes(10);

    @NotNull
    private Duration commandTimeout = Duration.ofMinutes(15);

    private List<String> protectedPatterns = new ArrayList<>(PipelineConfig.DEFAULT_PROTECTED_PATTERNS);

    /**
     * Whitespace separated command line, e.g. "mvn -B -q compile". Blank means auto-detect.
     */
    private String buildCommand = "";

    /**
     * Whitespace separated command line, e.g. "mvn -B test". Blank means auto-detect.
     */
    private String testCommand = "";

    public PipelineConfig toConfig() {
        return PipelineConfig.builder()
                .maxReviewIterations(maxReviewIterations)
                .maxCIRetries(maxCiRetries)
                .maxCompilationAttempts(maxCompilationAttempts)
                .maxTestAttempts(maxTestAttempts)
                .autoMerge(autoMerge)
                .requireCIPass(requireCiPass)
                .runLocalTests(runLocalTests)
                .forceApproveEnabled(forceApproveEnabled)
                .keepOursOnConflict(keepOursOnConflict)
                .deleteBranchAfterMerge(deleteBranchAfterMerge)
                .baseBranch(baseBranch)
                .mergeMethod(mergeMethod)
                .ciPollInterval(ciPollInterval)
                .ciWaitWindow(ciWaitWindow)
                .commandTimeout(commandTimeout)
                .protectedPatterns(List.copyOf(protectedPatterns))
                .buildCommand(splitCommand(buildCommand))
                .testCommand(splitCommand(testCommand))
                .build();
    }

    private static List<String> splitCommand(String command) {
        if (command == null || command.isBlank()) {
            return List.of();
        }
        return List.of(command.trim().split("\\s+"));
    }
}
