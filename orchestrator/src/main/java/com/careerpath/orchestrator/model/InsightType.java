package com.careerpath.orchestrator.model;

/**
 * Kind of narrative row in the insights table. {@link #value()} is the
 * lower-case form used in logs.
 */
public enum InsightType {
    OBSERVATION("observation"),
    CHALLENGE("challenge"),
    STORY("story");

    private final String value;

    InsightType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
