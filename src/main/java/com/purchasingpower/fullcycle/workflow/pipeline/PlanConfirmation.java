package com.purchasingpower.fullcycle.workflow.pipeline;

import com.purchasingpower.fullcycle.model.ExecutionPlan;

/**
 * Asks whoever started the run whether the plan may be executed.
 */
@FunctionalInterface
public interface PlanConfirmation {

    boolean confirmPlan(ExecutionPlan plan);

    static PlanConfirmation autoApprove() {
        return plan -> true;
    }
}
