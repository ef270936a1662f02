package com.careerpath.orchestrator.model;

import java.util.Locale;

/**
 * How far the user is from the target role on one skill.
 *
 * Stored by name in skill_gaps.gap_level; {@link #display()} is the
 * form shown to users and in prompts.
 */
public enum GapLevel {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String display;

    GapLevel(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }

    /**
     * Lenient mapping of whatever the provider wrote.
     * low/minor/small -> LOW, high/major/significant -> HIGH, anything else MEDIUM.
     */
    public static GapLevel fromText(String text) {
        if (text == null) {
            return MEDIUM;
        }
        String t = text.toLowerCase(Locale.ROOT);
        if (t.contains("low") || t.contains("minor") || t.contains("small")) {
            return LOW;
        }
        if (t.contains("high") || t.contains("major") || t.contains("significant")) {
            return HIGH;
        }
        return MEDIUM;
    }
}
