package com.purchasingpower.fullcycle.workflow.steps;

/**
 * How the self-review loop ended.
 *
 * @param approved   false only when the iteration budget ran out
 * @param iterations reviews performed
 * @param reason     why the loop stopped
 */
public record ReviewOutcome(boolean approved, int iterations, String reason) {
}
