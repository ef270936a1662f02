package com.careerpath.orchestrator.extract;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The top-level JSON shape a caller expects back from {@link ResponseExtractor}.
 */
public enum Shape {
    ARRAY,
    OBJECT;

    boolean matches(JsonNode node) {
        return node != null && (this == ARRAY ? node.isArray() : node.isObject());
    }
}
