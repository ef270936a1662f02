package com.careerpath.orchestrator.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a JSON value from the free-form text the completion and search
 * providers return.
 *
 * Tiers, first success wins:
 *   1. direct strict parse
 *   2. sanitize (BOM/control chars, truncation repair) then lenient parse
 *   3. each ``` fenced block, through 1-2
 *   4. the outermost [...] or {...} region, through 1-2
 *   5. "Label: value" lines assembled into records (arrays, some intents only)
 *   6. a typed empty value with ok=false
 *
 * Never throws. The returned value always has the requested {@link Shape}.
 */
public final class ResponseExtractor {

    private static final ObjectMapper STRICT = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private static final ObjectMapper LENIENT = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES,
                    JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES,
                    JsonReadFeature.ALLOW_TRAILING_COMMA,
                    JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS,
                    JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .build();

    // Matches ```json ... ``` or ``` ... ```; an unterminated fence runs to end of text
    private static final Pattern FENCE = Pattern.compile(
            "```[A-Za-z0-9_-]*[ \\t]*\\r?\\n?(.*?)(?:```|\\z)",
            Pattern.DOTALL
    );

    private static final Pattern ARRAY_REGION  = Pattern.compile("\\[.*\\]", Pattern.DOTALL);
    private static final Pattern OBJECT_REGION = Pattern.compile("\\{.*\\}", Pattern.DOTALL);

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    // "[truncated]", "...(truncated)", or a bare trailing "..." / "…"
    private static final Pattern TRUNCATION = Pattern.compile(
            "(?i)(?:\\.{3}|…)?\\s*[\\[(]truncated[\\])]|(?:\\.{3}|…)\\s*\\z"
    );

    // Repaired text is cut back to an earlier comma at most this many times
    private static final int MAX_REPAIR_CUTS = 3;

    // "- **Skill:** SQL", "1. Level: High", "Confidence: 80" ...
    private static final String LABELLED_LINE =
            "(?im)^\\s*(?:[-*•]|\\d+[.)])?\\s*\\**\\s*(?:%s)\\s*\\**\\s*:\\s*\\**\\s*(.+?)\\s*\\**\\s*$";

    private static final Map<String, Pattern> SKILL_GAP_LABELS = labels(
            "skillName",       "skill(?:\\s*name)?",
            "gapLevel",        "(?:gap\\s*)?level",
            "confidenceScore", "confidence(?:\\s*score)?",
            "mentionCount",    "mention\\s*count|mentions?",
            "contextSummary",  "context(?:\\s*summary)?|description"
    );
    private static final List<String> SKILL_GAP_REQUIRED = List.of("skillName", "gapLevel");

    private static final Map<String, Pattern> STORY_LABELS = labels(
            "source",  "source",
            "content", "content|story",
            "url",     "url|link",
            "date",    "date|posted"
    );
    private static final List<String> STORY_REQUIRED = List.of("content");

    private ResponseExtractor() {}

    public static Extraction extract(String raw, Shape shape) {
        return extract(raw, shape, ExtractionIntent.GENERIC);
    }

    public static Extraction extract(String raw, Shape shape, ExtractionIntent intent) {
        String text = raw == null ? "" : raw;

        Optional<JsonNode> direct = parse(text, shape, STRICT);
        if (direct.isPresent()) {
            return new Extraction(direct.get(), true, ExtractionTier.DIRECT);
        }
        Optional<JsonNode> sanitized = parseSanitized(text, shape);
        if (sanitized.isPresent()) {
            return new Extraction(sanitized.get(), true, ExtractionTier.SANITIZED);
        }

        Matcher fences = FENCE.matcher(text);
        while (fences.find()) {
            Optional<JsonNode> fenced = parseCandidate(fences.group(1), shape);
            if (fenced.isPresent()) {
                return new Extraction(fenced.get(), true, ExtractionTier.FENCED);
            }
        }

        Optional<JsonNode> region = parseRegion(text, shape);
        if (region.isPresent()) {
            return new Extraction(region.get(), true, ExtractionTier.REGION);
        }

        if (shape == Shape.ARRAY) {
            ArrayNode records = labelledRecords(text, intent);
            if (!records.isEmpty()) {
                return new Extraction(records, true, ExtractionTier.LABELLED);
            }
        }

        JsonNode empty = shape == Shape.ARRAY
                ? JsonNodeFactory.instance.arrayNode()
                : intent.emptyObject();
        return new Extraction(empty, false, ExtractionTier.FALLBACK);
    }

    // -------------------------------------------------------------------------
    // Parsing tiers
    // -------------------------------------------------------------------------

    private static Optional<JsonNode> parseCandidate(String text, Shape shape) {
        Optional<JsonNode> direct = parse(text, shape, STRICT);
        return direct.isPresent() ? direct : parseSanitized(text, shape);
    }

    private static Optional<JsonNode> parseSanitized(String text, Shape shape) {
        String clean = CONTROL_CHARS.matcher(text.replace("\uFEFF", "")).replaceAll("").strip();
        Matcher truncation = TRUNCATION.matcher(clean);
        if (!truncation.find()) {
            return parse(clean, shape, LENIENT);
        }

        String repaired = truncation.replaceAll("").strip();
        int start = firstOpening(repaired, shape);
        if (start > 0) {
            repaired = repaired.substring(start);
        }
        for (int cut = 0; cut <= MAX_REPAIR_CUTS; cut++) {
            Optional<JsonNode> parsed = parse(balance(repaired), shape, LENIENT);
            if (parsed.isPresent()) {
                return parsed;
            }
            int comma = repaired.lastIndexOf(',');
            if (comma < 0) {
                break;
            }
            repaired = repaired.substring(0, comma);
        }
        return Optional.empty();
    }

    private static Optional<JsonNode> parseRegion(String text, Shape shape) {
        if (shape == Shape.ARRAY) {
            Optional<JsonNode> array = region(text, ARRAY_REGION, shape);
            if (array.isPresent()) {
                return array;
            }
        }
        // For arrays too: providers often wrap the list in an object
        return region(text, OBJECT_REGION, shape);
    }

    private static Optional<JsonNode> region(String text, Pattern pattern, Shape shape) {
        Matcher m = pattern.matcher(text);
        return m.find() ? parseCandidate(m.group(), shape) : Optional.empty();
    }

    private static Optional<JsonNode> parse(String text, Shape shape, ObjectMapper mapper) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (shape.matches(node)) {
            return Optional.of(node);
        }
        if (shape == Shape.ARRAY && node != null && node.isObject()) {
            return firstArrayField(node);
        }
        return Optional.empty();
    }

    private static Optional<JsonNode> firstArrayField(JsonNode object) {
        Iterator<JsonNode> values = object.elements();
        while (values.hasNext()) {
            JsonNode value = values.next();
            if (value.isArray()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    // -------------------------------------------------------------------------
    // Truncation repair
    // -------------------------------------------------------------------------

    /**
     * Closes an unterminated string, drops a dangling comma and appends the
     * closers for every still-open bracket, innermost first.
     */
    static String balance(String text) {
        Deque<Character> closers = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        char quote = '"';
        char previous = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == quote) {
                    inString = false;
                }
            } else if (c == '"' || (c == '\'' && isValueStart(previous))) {
                inString = true;
                quote = c;
            } else if (c == '{') {
                closers.push('}');
            } else if (c == '[') {
                closers.push(']');
            } else if ((c == '}' || c == ']') && !closers.isEmpty() && closers.peek() == c) {
                closers.pop();
            }
            if (!Character.isWhitespace(c)) {
                previous = c;
            }
        }

        StringBuilder out = new StringBuilder(text);
        if (inString) {
            if (escaped) {
                out.setLength(out.length() - 1);
            }
            out.append(quote);
        }
        stripTrailingWhitespace(out);
        if (out.length() > 0 && out.charAt(out.length() - 1) == ',') {
            out.setLength(out.length() - 1);
        } else if (out.length() > 0 && out.charAt(out.length() - 1) == ':') {
            out.append("null");
        }
        while (!closers.isEmpty()) {
            out.append(closers.pop());
        }
        return out.toString();
    }

    private static int firstOpening(String text, Shape shape) {
        int array = text.indexOf('[');
        int object = text.indexOf('{');
        if (shape == Shape.OBJECT || array < 0) {
            return object;
        }
        return object < 0 ? array : Math.min(array, object);
    }

    private static boolean isValueStart(char previous) {
        return previous == 0 || previous == '[' || previous == '{' || previous == ',' || previous == ':';
    }

    private static void stripTrailingWhitespace(StringBuilder sb) {
        while (sb.length() > 0 && Character.isWhitespace(sb.charAt(sb.length() - 1))) {
            sb.setLength(sb.length() - 1);
        }
    }

    // -------------------------------------------------------------------------
    // Labelled records
    // -------------------------------------------------------------------------

    private static ArrayNode labelledRecords(String text, ExtractionIntent intent) {
        ArrayNode records = JsonNodeFactory.instance.arrayNode();
        Map<String, Pattern> labels;
        List<String> required;
        if (intent == ExtractionIntent.SKILL_GAPS) {
            labels = SKILL_GAP_LABELS;
            required = SKILL_GAP_REQUIRED;
        } else if (intent == ExtractionIntent.STORIES) {
            labels = STORY_LABELS;
            required = STORY_REQUIRED;
        } else {
            return records;
        }

        ObjectNode current = JsonNodeFactory.instance.objectNode();
        for (String line : text.split("\\r?\\n")) {
            for (Map.Entry<String, Pattern> label : labels.entrySet()) {
                Matcher m = label.getValue().matcher(line);
                if (!m.find()) {
                    continue;
                }
                // A repeated field starts the next record
                if (current.has(label.getKey())) {
                    accept(records, current, required);
                    current = JsonNodeFactory.instance.objectNode();
                }
                current.put(label.getKey(), m.group(1));
                break;
            }
        }
        accept(records, current, required);
        return records;
    }

    private static void accept(ArrayNode records, ObjectNode record, List<String> required) {
        for (String field : required) {
            JsonNode value = record.get(field);
            if (value == null || value.asText().isBlank()) {
                return;
            }
        }
        records.add(record);
    }

    private static Map<String, Pattern> labels(String... fieldAndLabels) {
        Map<String, Pattern> out = new LinkedHashMap<>();
        for (int i = 0; i < fieldAndLabels.length; i += 2) {
            out.put(fieldAndLabels[i], Pattern.compile(String.format(LABELLED_LINE, fieldAndLabels[i + 1])));
        }
        return out;
    }
}
