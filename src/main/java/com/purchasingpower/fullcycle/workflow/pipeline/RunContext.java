package com.purchasingpower.fullcycle.workflow.pipeline;

import com.purchasingpower.fullcycle.model.ExecutionPlan;
import com.purchasingpower.fullcycle.model.FileChange;
import com.purchasingpower.fullcycle.model.PipelineConfig;
import com.purchasingpower.fullcycle.model.PullRequestRef;
import com.purchasingpower.fullcycle.model.RepositoryCoordinates;
import com.purchasingpower.fullcycle.model.RunStatistics;
import com.purchasingpower.fullcycle.service.VersionControlDriver;
import com.purchasingpower.fullcycle.util.ProtectedPathMatcher;
import com.purchasingpower.fullcycle.workflow.state.PipelineState;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * State carried through one pipeline run.
 *
 * <p>Created by the orchestrator and handed to each stage; never shared between runs.
 */
@Slf4j
@Getter
public class RunContext {

    private final String runId = UUID.randomUUID().toString().substring(0, 8);
    private final String taskDescription;
    private final Path projectRoot;
    private final PipelineConfig config;
    private final PipelineListener listener;
    private final ProtectedPathMatcher protectedPaths;
    private final Instant startedAt = Instant.now();
    private final RunStatistics statistics = new RunStatistics();
    private final ReviewConvergenceTracker convergenceTracker = new ReviewConvergenceTracker();

    @Setter
    private VersionControlDriver vcs;
    @Setter
    private RepositoryCoordinates repository;
    @Setter
    private String retrievedContext = "";
    @Setter
    private ExecutionPlan plan;
    @Setter
    private String branchName;
    @Setter
    private PullRequestRef pullRequest;

    private PipelineState state;
    private int reviewIterations;
    private int ciRuns;

    @Getter(AccessLevel.NONE)
    private final Map<String, FileChange> changedFiles = new LinkedHashMap<>();
    @Getter(AccessLevel.NONE)
    private final Set<String> createdPaths = new LinkedHashSet<>();
    @Getter(AccessLevel.NONE)
    private final List<String> errors = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private final List<String> warnings = new ArrayList<>();

    public RunContext(String taskDescription, Path projectRoot, PipelineConfig config, PipelineListener listener) {
        this.taskDescription = taskDescription;
        this.projectRoot = projectRoot;
        this.config = config;
        this.listener = listener == null ? PipelineListener.NONE : listener;
        this.protectedPaths = new ProtectedPathMatcher(config.getProtectedPatterns());
    }

    public void transition(PipelineState next) {
        this.state = next;
        statistics.recordState(next.name());
        log.debug("[{}] state -> {}", runId, next);
        try {
            listener.onStateChange(next);
        } catch (RuntimeException e) {
            log.warn("State listener failed on {}: {}", next.name(), e.getMessage());
        }
    }

    public void progress(String message) {
        log.info("[{}] {}", runId, message);
        try {
            listener.onProgress(message);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed: {}", e.getMessage());
        }
    }

    public void recordChange(FileChange change) {
        changedFiles.merge(change.path(), change, FileChange::mergedWith);
        if (change.isNew()) {
            createdPaths.add(change.path());
        }
    }

    public List<FileChange> getChangedFiles() {
        return List.copyOf(changedFiles.values());
    }

    /**
     * Every path the run wrote or deleted.
     */
    public Set<String> getTouchedPaths() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(changedFiles.keySet()));
    }

    /**
     * Touched paths that existed before the run, i.e. can be restored from HEAD.
     */
    public Set<String> getTrackedTouchedPaths() {
        Set<String> tracked = new LinkedHashSet<>(changedFiles.keySet());
        tracked.removeAll(createdPaths);
        return tracked;
    }

    public Set<String> getCreatedPaths() {
        return Collections.unmodifiableSet(createdPaths);
    }

    public void warn(String warning) {
        log.warn("⚠️ [{}] {}", runId, warning);
        warnings.add(warning);
    }

    public void error(String error) {
        errors.add(error);
    }

    public List<String> getWarnings() {
        return List.copyOf(warnings);
    }

    public List<String> getErrors() {
        return List.copyOf(errors);
    }

    public void incrementReviewIterations() {
        reviewIterations++;
    }

    public void incrementCiRuns() {
        ciRuns++;
    }
}
