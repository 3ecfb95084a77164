package com.purchasingpower.fullcycle.model;

public enum Mergeability {
    MERGEABLE,
    CONFLICTING,
    /** The platform has not finished computing mergeability yet. */
    UNKNOWN
}
