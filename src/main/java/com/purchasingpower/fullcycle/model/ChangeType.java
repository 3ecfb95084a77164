package com.purchasingpower.fullcycle.model;

import java.util.Locale;

/**
 * Kind of file change a plan entry asks for.
 *
 * <p>Replaces the "create"/"modify"/"delete" strings found in LLM output with a type-safe enum.
 */
public enum ChangeType {

    CREATE("+"),
    MODIFY("~"),
    DELETE("-");

    private final String icon;

    ChangeType(String icon) {
        this.icon = icon;
    }

    /**
     * Short marker used when a plan is printed: "+", "~" or "-".
     */
    public String getIcon() {
        return icon;
    }

    /**
     * Parse a change type leniently (case-insensitive, common synonyms accepted).
     *
     * @param value raw value from LLM output
     * @return parsed type, or {@code null} when the value is not recognised
     */
    public static ChangeType fromString(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "CREATE", "ADD", "NEW" -> CREATE;
            case "MODIFY", "UPDATE", "EDIT", "CHANGE" -> MODIFY;
            case "DELETE", "REMOVE" -> DELETE;
            default -> null;
        };
    }

    public boolean isWrite() {
        return this == CREATE || this == MODIFY;
    }

    public boolean isDelete() {
        return this == DELETE;
    }
}
