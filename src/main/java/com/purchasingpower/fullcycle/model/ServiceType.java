package com.purchasingpower.fullcycle.model;

/**
 * Enumeration of external service types for unified logging.
 *
 * Used by ExternalCallLogger to categorize and log calls to
 * different external services with consistent formatting.
 *
 * @see com.purchasingpower.fullcycle.util.ExternalCallLogger
 */
public enum ServiceType {
    ANTHROPIC("🟣", "Anthropic"),
    GEMINI("🔴", "Gemini"),
    GITHUB("⚫", "GitHub"),
    GIT("🔷", "Git"),
    BUILD("🟠", "Build");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
