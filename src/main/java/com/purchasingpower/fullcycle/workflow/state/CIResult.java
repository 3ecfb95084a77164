package com.purchasingpower.fullcycle.workflow.state;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Snapshot of the CI state of a pull request.
 */
@Value
@Builder
public class CIResult {

    private static final Set<String> FAILING_CONCLUSIONS =
            Set.of("failure", "cancelled", "timed_out", "action_required", "startup_failure");

    private static final Set<String> PASSING_CONCLUSIONS = Set.of("success", "neutral", "skipped");

    CiStatus status;

    String checkName;

    String logs;

    String errorMessage;

    Long runId;

    /**
     * One check run as reported by the hosting platform.
     *
     * @param status     "queued", "in_progress" or "completed"
     * @param conclusion set once completed, e.g. "success" or "failure"
     */
    public record CheckRun(String name, String status, String conclusion) {
    }

    public static CIResult of(CiStatus status) {
        return CIResult.builder().status(status).build();
    }

    public static CIResult pending() {
        return of(CiStatus.PENDING);
    }

    /**
     * Aggregate individual check runs into one verdict.
     *
     * <ul>
     *   <li>all completed and passing: SUCCESS</li>
     *   <li>any failing conclusion: FAILED, naming the first failing check</li>
     *   <li>cancelled checks and no other failure: CANCELLED</li>
     *   <li>all completed otherwise: FAILED</li>
     *   <li>some still queued or in progress: RUNNING</li>
     *   <li>no checks at all: SUCCESS when the PR is mergeable (repository without CI), else PENDING</li>
     * </ul>
     */
    public static CIResult fromCheckRuns(List<CheckRun> checks, boolean mergeable) {
        if (checks == null || checks.isEmpty()) {
            return mergeable ? of(CiStatus.SUCCESS) : pending();
        }

        CheckRun firstFailing = checks.stream()
                .filter(c -> c.conclusion() != null
                        && FAILING_CONCLUSIONS.contains(c.conclusion().toLowerCase(Locale.ROOT))
                        && !"cancelled".equalsIgnoreCase(c.conclusion()))
                .findFirst()
                .orElse(null);
        boolean anyCancelled = checks.stream().anyMatch(c -> "cancelled".equalsIgnoreCase(c.conclusion()));
        if (firstFailing == null && anyCancelled) {
            return of(CiStatus.CANCELLED);
        }
        if (firstFailing != null) {
            return CIResult.builder()
                    .status(CiStatus.FAILED)
                    .checkName(firstFailing.name())
                    .errorMessage("Check '" + firstFailing.name() + "' concluded " + firstFailing.conclusion())
                    .build();
        }

        boolean allCompleted = checks.stream()
                .allMatch(c -> "completed".equalsIgnoreCase(c.status()));
        if (!allCompleted) {
            return of(CiStatus.RUNNING);
        }

        boolean allPassing = checks.stream()
                .allMatch(c -> c.conclusion() != null
                        && PASSING_CONCLUSIONS.contains(c.conclusion().toLowerCase(Locale.ROOT)));
        return allPassing
                ? of(CiStatus.SUCCESS)
                : CIResult.builder().status(CiStatus.FAILED).errorMessage("Some checks not successful").build();
    }
}
