package com.purchasingpower.research.model.research;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Confidence a source assigns to one extracted claim.
 */
public enum Confidence {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps a model-supplied label onto a confidence level. Null, blank and unknown labels become MEDIUM.
     */
    public static Confidence normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "high" -> HIGH;
            case "low" -> LOW;
            default -> MEDIUM;
        };
    }
}
