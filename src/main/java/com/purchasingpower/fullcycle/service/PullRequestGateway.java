package com.purchasingpower.fullcycle.service;

import com.purchasingpower.fullcycle.model.MergeMethod;
import com.purchasingpower.fullcycle.model.Mergeability;
import com.purchasingpower.fullcycle.model.PullRequestRef;
import com.purchasingpower.fullcycle.model.RepositoryCoordinates;
import com.purchasingpower.fullcycle.workflow.state.CIResult;

import java.util.Optional;

/**
 * Pull request and CI operations on the hosting platform.
 *
 * <p>Failures surface as {@link com.purchasingpower.fullcycle.exception.PullRequestException}.
 */
public interface PullRequestGateway {

    /**
     * Open pull request whose head is {@code headBranch}, if any.
     */
    Optional<PullRequestRef> findOpenPullRequest(RepositoryCoordinates repo, String headBranch);

    PullRequestRef createPullRequest(RepositoryCoordinates repo, String title, String body,
                                     String headBranch, String baseBranch);

    Mergeability getMergeability(RepositoryCoordinates repo, int prNumber);

    /**
     * Aggregated status of the checks on the pull request's head commit.
     */
    CIResult getCiStatus(RepositoryCoordinates repo, int prNumber);

    /**
     * Id of the most recent failed workflow run on {@code branch}.
     */
    Optional<Long> findLatestFailedRunId(RepositoryCoordinates repo, String branch);

    /**
     * Logs of the failed jobs of a workflow run, concatenated.
     */
    String fetchRunLogs(RepositoryCoordinates repo, long runId);

    /**
     * Unified diff of the pull request against its base.
     */
    String getPullRequestDiff(RepositoryCoordinates repo, int prNumber);

    /**
     * Post a comment-only review.
     */
    void publishReview(RepositoryCoordinates repo, int prNumber, String body);

    void merge(RepositoryCoordinates repo, int prNumber, MergeMethod method, String commitTitle);
}
