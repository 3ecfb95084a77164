package com.purchasingpower.fullcycle.workflow.state;

public enum CiStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED,
    CANCELLED;

    /**
     * SUCCESS, FAILED and CANCELLED end a wait cycle.
     */
    public boolean isFinal() {
        return this == SUCCESS || this == FAILED || this == CANCELLED;
    }
}
