package com.purchasingpower.fullcycle.workflow.state;

public enum CiFailureType {
    COMPILATION("compilation"),
    TEST("test"),
    LINT("lint"),
    UNKNOWN("unknown");

    private final String label;

    CiFailureType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
