package com.purchasingpower.fullcycle.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One intended file change of an {@link ExecutionPlan}.
 */
@Value
@Builder
public class PlannedChange {

    /**
     * Path relative to the project root, always with '/' separators.
     */
    @NonNull
    String filePath;

    @NonNull
    ChangeType changeType;

    String description;
}
