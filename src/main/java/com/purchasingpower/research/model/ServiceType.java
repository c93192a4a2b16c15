package com.purchasingpower.research.model;

/**
 * External services a research run talks to, for call logging.
 *
 * @see com.purchasingpower.research.util.ExternalCallLogger
 */
public enum ServiceType {
    ANTHROPIC("🟣", "Anthropic"),
    GEMINI("🔴", "Gemini"),
    DUCKDUCKGO("🦆", "DuckDuckGo"),
    GOOGLE("🔵", "Google Search"),
    WEB("🌐", "Web");

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
