package com.careerpath.orchestrator.extract;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lookups over extracted records whose field names drift between responses
 * (skillName / skill_name / skill ...). Each method returns the first
 * usable value among the given names.
 */
public final class JsonFields {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");

    private JsonFields() {}

    /** Non-blank text (numbers and booleans rendered as text). */
    public static Optional<String> text(JsonNode node, String... names) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && value.isValueNode() && !value.isNull()) {
                String text = value.asText().strip();
                if (!text.isEmpty()) {
                    return Optional.of(text);
                }
            }
        }
        return Optional.empty();
    }

    /** A number, or the first number found in a text value ("65%", "3 months"). */
    public static Optional<Double> number(JsonNode node, String... names) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value == null) {
                continue;
            }
            if (value.isNumber()) {
                return Optional.of(value.asDouble());
            }
            if (value.isTextual()) {
                Optional<Double> parsed = firstNumber(value.asText());
                if (parsed.isPresent()) {
                    return parsed;
                }
            }
        }
        return Optional.empty();
    }

    /** Rounded, saturating at the int range instead of wrapping. */
    public static Optional<Integer> integer(JsonNode node, String... names) {
        return number(node, names).map(JsonFields::toInt);
    }

    public static int toInt(double d) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, Math.round(d)));
    }

    public static Optional<JsonNode> array(JsonNode node, String... names) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && value.isArray()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public static Optional<Double> firstNumber(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = NUMBER.matcher(text);
        return m.find() ? Optional.of(Double.parseDouble(m.group())) : Optional.empty();
    }
}
