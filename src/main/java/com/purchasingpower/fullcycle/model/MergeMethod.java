package com.purchasingpower.fullcycle.model;

/**
 * Merge strategy sent to the hosting platform when the pull request is merged.
 */
public enum MergeMethod {
    SQUASH("squash"),
    MERGE("merge"),
    REBASE("rebase");

    private final String apiValue;

    MergeMethod(String apiValue) {
        this.apiValue = apiValue;
    }

    public String getApiValue() {
        return apiValue;
    }
}
