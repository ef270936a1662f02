package com.careerpath.orchestrator.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Result of {@link ResponseExtractor#extract}.
 *
 * value is never null and always has the requested {@link Shape};
 * ok is false only when the typed empty fallback was returned.
 */
public record Extraction(JsonNode value, boolean ok, ExtractionTier tier) {

    public ArrayNode array() {
        return (ArrayNode) value;
    }

    public ObjectNode object() {
        return (ObjectNode) value;
    }
}
