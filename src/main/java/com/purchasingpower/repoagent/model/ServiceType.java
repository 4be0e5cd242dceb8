package com.purchasingpower.repoagent.model;

/**
 * External services the engine talks to, for unified call logging.
 *
 * @see com.purchasingpower.repoagent.util.ExternalCallLogger
 */
public enum ServiceType {
    GIT("🔷", "Git"),
    GITHUB_API("⚫", "GitHub API"),
    LLM("🔴", "Completion API");

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
