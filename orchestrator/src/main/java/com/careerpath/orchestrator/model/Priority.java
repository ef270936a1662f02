package com.careerpath.orchestrator.model;

/**
 * Milestone priority. Parsed with the same substring rule as {@link GapLevel}.
 */
public enum Priority {
    LOW,
    MEDIUM,
    HIGH;

    public static Priority fromText(String text) {
        return of(GapLevel.fromText(text));
    }

    public static Priority of(GapLevel level) {
        return switch (level) {
            case LOW    -> LOW;
            case MEDIUM -> MEDIUM;
            case HIGH   -> HIGH;
        };
    }
}
