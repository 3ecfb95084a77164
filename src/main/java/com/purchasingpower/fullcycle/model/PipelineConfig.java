package com.purchasingpower.fullcycle.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Immutable settings for one pipeline run.
 *
 * <p>Built from {@link com.purchasingpower.fullcycle.config.PipelineProperties} at run start,
 * optionally adjusted by command line flags, and never modified afterwards.
 */
@Value
@Builder(toBuilder = true)
public class PipelineConfig {

    public static final List<String> DEFAULT_PROTECTED_PATTERNS = List.of(
            ".env",
            ".env.*",
            "*.env",
            "*.env.*",
            "**/secrets/**",
            "**/credentials/**",
            "*.pem",
            "*.key"
    );

    @Builder.Default
    int maxReviewIterations = 10;

    @Builder.Default
    int maxCIRetries = 5;

    @Builder.Default
    int maxCompilationAttempts = 3;

    @Builder.Default
    int maxTestAttempts = 2;

    @Builder.Default
    boolean autoMerge = true;

    @Builder.Default
    boolean requireCIPass = true;

    @Builder.Default
    boolean runLocalTests = true;

    @Builder.Default
    List<String> protectedPatterns = DEFAULT_PROTECTED_PATTERNS;

    /**
     * Enables the stuck, fatigue and ceiling rules of the review loop.
     * Off unless explicitly requested: forcing approval can hide real defects.
     */
    @Builder.Default
    boolean forceApproveEnabled = false;

    /**
     * Enables automatic conflict resolution that keeps the branch's own version of every
     * conflicting file. Off unless explicitly requested: upstream edits to those files are lost.
     */
    @Builder.Default
    boolean keepOursOnConflict = false;

    @Builder.Default
    boolean deleteBranchAfterMerge = true;

    @Builder.Default
    String baseBranch = "main";

    @Builder.Default
    MergeMethod mergeMethod = MergeMethod.SQUASH;

    @Builder.Default
    Duration ciPollInterval = Duration.ofSeconds(15);

    @Builder.Default
    Duration ciWaitWindow = Duration.ofMinutes(10);

    /**
     * Build command line; empty means "detect from the project's build file".
     */
    @Builder.Default
    List<String> buildCommand = List.of();

    /**
     * Test command line; empty means "detect from the project's build file".
     */
    @Builder.Default
    List<String> testCommand = List.of();

    @Builder.Default
    Duration commandTimeout = Duration.ofMinutes(15);

    public static PipelineConfig defaults() {
        return PipelineConfig.builder().build();
    }
}
