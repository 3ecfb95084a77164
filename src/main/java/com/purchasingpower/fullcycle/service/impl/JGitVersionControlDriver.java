package com.purchasingpower.fullcycle.service.impl;

import com.purchasingpower.fullcycle.exception.PushFailedException;
import com.purchasingpower.fullcycle.exception.VersionControlException;
import com.purchasingpower.fullcycle.model.CallContext;
import com.purchasingpower.fullcycle.model.ServiceType;
import com.purchasingpower.fullcycle.service.RebaseOutcome;
import com.purchasingpower.fullcycle.service.VersionControlDriver;
import com.purchasingpower.fullcycle.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.CheckoutCommand;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.PullResult;
import org.eclipse.jgit.api.RebaseCommand;
import org.eclipse.jgit.api.RebaseResult;
import org.eclipse.jgit.api.Status;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.PushResult;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.transport.RemoteRefUpdate;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * {@link VersionControlDriver} backed by an open JGit repository.
 */
@Slf4j
public class JGitVersionControlDriver implements VersionControlDriver {

    private static final String REMOTE = "origin";

    private final Git git;
    private final CredentialsProvider credentials;

    public JGitVersionControlDriver(Git git, CredentialsProvider credentials) {
        this.git = git;
        this.credentials = credentials;
    }

    @Override
    public String currentBranch() {
        try {
            return git.getRepository().getBranch();
        } catch (IOException e) {
            throw new VersionControlException("Failed to read current branch", e);
        }
    }

    @Override
    public Optional<String> remoteUrl(String remote) {
        return Optional.ofNullable(git.getRepository().getConfig().getString("remote", remote, "url"));
    }

    @Override
    public void createAndCheckoutBranch(String branchName) {
        log.info("Creating and switching to new branch: {}", branchName);
        try {
            // Fails if the branch exists, which protects earlier work on it
            git.checkout().setCreateBranch(true).setName(branchName).call();
        } catch (GitAPIException e) {
            throw new VersionControlException("Failed to create branch " + branchName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void checkout(String branchName) {
        try {
            git.checkout().setName(branchName).call();
        } catch (GitAPIException e) {
            throw new VersionControlException("Failed to checkout " + branchName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void stage(Collection<String> paths) {
        if (paths.isEmpty()) {
            return;
        }
        try {
            var add = git.add();
            var update = git.add().setUpdate(true);
            for (String path : paths) {
                add.addFilepattern(path);
                update.addFilepattern(path);
            }
            add.call();
            // setUpdate picks up deletions of tracked files
            update.call();
        } catch (GitAPIException e) {
            throw new VersionControlException("Failed to stage " + paths + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean commit(String message) {
        try {
            Status status = git.status().call();
            if (status.getAdded().isEmpty() && status.getChanged().isEmpty() && status.getRemoved().isEmpty()) {
                log.info("Nothing staged, skipping commit '{}'", message);
                return false;
            }
            git.commit().setMessage(message).call();
            log.info("Committed: {}", message);
            return true;
        } catch (GitAPIException e) {
            throw new VersionControlException("Git Commit Failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void push(String branch, boolean force) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GIT, "push", log);
        callCtx.logRequest("Pushing branch", "Branch", branch, "Remote", REMOTE, "Force", force);
        Iterable<PushResult> results;
        try {
            results = git.push()
                    .setRemote(REMOTE)
                    .setRefSpecs(new RefSpec(branch + ":" + branch))
                    .setForce(force)
                    .setCredentialsProvider(credentials)
                    .call();
        } catch (GitAPIException e) {
            callCtx.logError(e.getMessage(), e);
            throw new PushFailedException("Git Push Failed: " + e.getMessage(), e);
        }

        for (PushResult result : results) {
            for (RemoteRefUpdate update : result.getRemoteUpdates()) {
                RemoteRefUpdate.Status status = update.getStatus();
                if (status != RemoteRefUpdate.Status.OK && status != RemoteRefUpdate.Status.UP_TO_DATE) {
                    PushFailedException rejected = new PushFailedException("Git Push Failed: "
                            + update.getRemoteName() + " " + status
                            + (update.getMessage() != null ? " (" + update.getMessage() + ")" : ""));
                    callCtx.logError(rejected.getMessage(), rejected);
                    throw rejected;
                }
            }
        }
        callCtx.logResponse("Push successful");
    }

    @Override
    public void fetch() {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GIT, "fetch", log);
        callCtx.logRequest("Fetching", "Remote", REMOTE);
        try {
            git.fetch().setRemote(REMOTE).setCredentialsProvider(credentials).call();
            callCtx.logResponse("Fetch complete");
        } catch (GitAPIException e) {
            callCtx.logError(e.getMessage(), e);
            throw new VersionControlException("Git Fetch Failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void pull(String branch) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GIT, "pull", log);
        callCtx.logRequest("Pulling", "Branch", branch, "Remote", REMOTE);
        PullResult result;
        try {
            result = git.pull()
                    .setRemote(REMOTE)
                    .setRemoteBranchName(branch)
                    .setCredentialsProvider(credentials)
                    .call();
        } catch (GitAPIException e) {
            callCtx.logError(e.getMessage(), e);
            throw new VersionControlException("Git Pull Failed: " + e.getMessage(), e);
        }
        if (!result.isSuccessful()) {
            VersionControlException failed = new VersionControlException("Git Pull Failed for " + branch + ": " + result);
            callCtx.logError(failed.getMessage(), failed);
            throw failed;
        }
        callCtx.logResponse("Pull complete");
    }

    @Override
    public RebaseOutcome rebase(String upstream) {
        log.info("Rebasing '{}' onto {}", currentBranch(), upstream);
        try {
            return toOutcome(git.rebase().setUpstream(upstream).call());
        } catch (GitAPIException e) {
            return RebaseOutcome.failed("Rebase onto " + upstream + " failed: " + e.getMessage());
        }
    }

    @Override
    public void keepOwnVersion(List<String> paths) {
        if (paths.isEmpty()) {
            return;
        }
        try {
            // While rebasing, "theirs" is the commit being replayed, i.e. the branch's own change
            git.checkout().setStage(CheckoutCommand.Stage.THEIRS).addPaths(paths).call();
            stage(paths);
        } catch (GitAPIException e) {
            throw new VersionControlException("Failed to resolve conflicts in " + paths + ": " + e.getMessage(), e);
        }
    }

    @Override
    public RebaseOutcome continueRebase() {
        try {
            return toOutcome(git.rebase().setOperation(RebaseCommand.Operation.CONTINUE).call());
        } catch (GitAPIException e) {
            return RebaseOutcome.failed("Rebase continue failed: " + e.getMessage());
        }
    }

    @Override
    public void abortRebase() {
        try {
            git.rebase().setOperation(RebaseCommand.Operation.ABORT).call();
        } catch (GitAPIException e) {
            throw new VersionControlException("Rebase abort failed: " + e.getMessage(), e);
        }
    }

    private RebaseOutcome toOutcome(RebaseResult result) throws GitAPIException {
        RebaseResult.Status status = result.getStatus();
        if (status == RebaseResult.Status.STOPPED) {
            List<String> conflicts = new ArrayList<>(git.status().call().getConflicting());
            return RebaseOutcome.conflicts(conflicts);
        }
        if (status.isSuccessful()) {
            return RebaseOutcome.ok();
        }
        List<String> paths = new ArrayList<>();
        if (result.getConflicts() != null) {
            paths.addAll(result.getConflicts());
        }
        if (result.getFailingPaths() != null) {
            paths.addAll(result.getFailingPaths().keySet());
        }
        return RebaseOutcome.failed("Rebase " + status + (paths.isEmpty() ? "" : " on " + paths));
    }

    @Override
    public void deleteBranch(String branchName) {
        try {
            // Force: after a squash merge the branch is not an ancestor of the base
            git.branchDelete().setBranchNames(branchName).setForce(true).call();
        } catch (GitAPIException e) {
            throw new VersionControlException("Failed to delete branch " + branchName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void revert(Collection<String> trackedPaths, Collection<String> createdPaths) {
        try {
            if (!trackedPaths.isEmpty()) {
                git.checkout().setStartPoint("HEAD").addPaths(new ArrayList<>(trackedPaths)).call();
            }
            File root = git.getRepository().getWorkTree();
            for (String path : createdPaths) {
                Files.deleteIfExists(root.toPath().resolve(path));
            }
            log.info("Reverted {} tracked and {} created files", trackedPaths.size(), createdPaths.size());
        } catch (GitAPIException | IOException e) {
            throw new VersionControlException("Failed to revert working tree: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        git.close();
    }
}
