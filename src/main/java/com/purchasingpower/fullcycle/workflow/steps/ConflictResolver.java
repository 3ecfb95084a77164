package com.purchasingpower.fullcycle.workflow.steps;

import com.purchasingpower.fullcycle.exception.MergeConflictException;
import com.purchasingpower.fullcycle.exception.VersionControlException;
import com.purchasingpower.fullcycle.service.RebaseOutcome;
import com.purchasingpower.fullcycle.service.VersionControlDriver;
import com.purchasingpower.fullcycle.workflow.pipeline.RunContext;
import com.purchasingpower.fullcycle.workflow.state.PipelineState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Brings a conflicting branch up to date by rebasing it onto the base branch.
 *
 * <p>Conflicts are resolved automatically only when {@code keepOursOnConflict} is enabled, by
 * keeping the branch's own version of each conflicting file. The rebased branch is force-pushed.
 */
@Slf4j
@Component
public class ConflictResolver {

    /**
     * Upper bound on replayed commits that may each stop with conflicts.
     */
    static final int MAX_CONFLICT_ROUNDS = 50;

    /**
     * @throws MergeConflictException when the conflicts cannot be resolved; the rebase is aborted first
     */
    public void resolve(RunContext ctx) {
        VersionControlDriver vcs = ctx.getVcs();
        String base = ctx.getConfig().getBaseBranch();
        String branch = ctx.getBranchName();

        ctx.progress("🔀 Rebasing " + branch + " onto origin/" + base);
        vcs.fetch();
        RebaseOutcome outcome = vcs.rebase("origin/" + base);
        Set<String> resolved = new LinkedHashSet<>();

        for (int round = 1; outcome.status() == RebaseOutcome.Status.CONFLICTS; round++) {
            List<String> files = outcome.conflictingFiles();
            ctx.transition(new PipelineState.ResolvingConflicts(files));
            ctx.progress("⚠️ Conflicts in " + files);

            if (!ctx.getConfig().isKeepOursOnConflict()) {
                abortQuietly(vcs);
                throw new MergeConflictException("Merge conflicts in " + files
                        + " (automatic resolution is disabled, use --keep-ours to enable it)", files);
            }
            if (round > MAX_CONFLICT_ROUNDS) {
                abortQuietly(vcs);
                throw new MergeConflictException("Too many conflicting commits while rebasing onto " + base, files);
            }

            try {
                vcs.keepOwnVersion(files);
                resolved.addAll(files);
                outcome = vcs.continueRebase();
            } catch (VersionControlException e) {
                abortQuietly(vcs);
                throw new MergeConflictException("Could not keep this branch's version of " + files
                        + ": " + e.getMessage(), files, e);
            }
        }

        if (outcome.status() == RebaseOutcome.Status.FAILED) {
            abortQuietly(vcs);
            throw new MergeConflictException("Irreconcilable conflicts: " + outcome.message(), List.copyOf(resolved));
        }

        if (!resolved.isEmpty()) {
            ctx.warn("Resolved conflicts by keeping this branch's version of " + resolved);
        }
        vcs.push(branch, true);
        ctx.progress("✅ Branch rebased onto " + base + " and force-pushed");
    }

    private void abortQuietly(VersionControlDriver vcs) {
        try {
            vcs.abortRebase();
        } catch (VersionControlException e) {
            log.warn("⚠️ Could not abort rebase: {}", e.getMessage());
        }
    }
}
