package com.purchasingpower.fullcycle.workflow.steps;

/**
 * How waiting on CI ended.
 *
 * @param failureReason set when {@code passed} is false
 */
public record CiOutcome(boolean passed, int fixAttempts, String failureReason) {

    static CiOutcome passed(int fixAttempts) {
        return new CiOutcome(true, fixAttempts, null);
    }

    static CiOutcome failed(int fixAttempts, String reason) {
        return new CiOutcome(false, fixAttempts, reason);
    }
}
