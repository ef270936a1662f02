package com.careerpath.orchestrator.extract;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * What the caller is trying to recover. Drives the labelled-line patterns
 * and the empty skeleton returned when every tier fails.
 */
public enum ExtractionIntent {
    GENERIC,
    STORIES,
    SKILL_GAPS,
    INSIGHTS,
    PLAN;

    /** Minimal object skeleton for this intent; always a fresh instance. */
    ObjectNode emptyObject() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        switch (this) {
            case PLAN -> node.putArray("milestones");
            case INSIGHTS -> {
                node.putArray("keyObservations");
                node.putArray("commonChallenges");
            }
            default -> { }
        }
        return node;
    }
}
