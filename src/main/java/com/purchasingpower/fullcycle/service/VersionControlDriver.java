package com.purchasingpower.fullcycle.service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Git operations on the working copy of one pipeline run.
 *
 * <p>An instance is bound to a single repository and is closed when the run ends. Paths are
 * relative to the repository root with '/' separators. Failures surface as
 * {@link com.purchasingpower.fullcycle.exception.VersionControlException}.
 */
public interface VersionControlDriver extends AutoCloseable {

    String currentBranch();

    /**
     * URL of the named remote, if configured.
     */
    Optional<String> remoteUrl(String remote);

    /**
     * Create a branch at HEAD and switch to it. Fails if the branch already exists.
     */
    void createAndCheckoutBranch(String branchName);

    void checkout(String branchName);

    /**
     * Stage the given paths, including deletions of tracked files.
     */
    void stage(Collection<String> paths);

    /**
     * Commit what is staged.
     *
     * @return false when nothing was staged and no commit was created
     */
    boolean commit(String message);

    /**
     * Push {@code branch} to the same name on origin.
     *
     * @param force overwrite the remote branch (needed after a rebase)
     * @throws com.purchasingpower.fullcycle.exception.PushFailedException when the remote rejects the update
     */
    void push(String branch, boolean force);

    /**
     * Fetch all branches from origin.
     */
    void fetch();

    /**
     * Fast-forward the current branch to {@code origin/<branch>}.
     */
    void pull(String branch);

    RebaseOutcome rebase(String upstream);

    /**
     * During a stopped rebase, resolve the given paths by taking the version from the commit being
     * replayed (the branch's own change) and stage them.
     */
    void keepOwnVersion(List<String> paths);

    RebaseOutcome continueRebase();

    void abortRebase();

    void deleteBranch(String branchName);

    /**
     * Restore the given tracked paths to HEAD and delete the given untracked files.
     */
    void revert(Collection<String> trackedPaths, Collection<String> createdPaths);

    /**
     * Stage the paths, commit, and push the branch; does nothing when the commit would be empty.
     *
     * @return true if a commit was pushed
     */
    default boolean commitAndPush(Collection<String> paths, String message, String branch) {
        stage(paths);
        if (!commit(message)) {
            return false;
        }
        push(branch, false);
        return true;
    }

    @Override
    void close();
}
