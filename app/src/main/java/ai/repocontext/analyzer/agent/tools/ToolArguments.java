package ai.repocontext.analyzer.agent.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Flat string-to-string arguments of a tool call.
 */
final class ToolArguments {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final Map<String, String> values;

    private ToolArguments(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Decodes raw JSON arguments. Only an object whose values are all strings is accepted.
     *
     * @throws IllegalArgumentException when the payload has any other shape
     */
    static ToolArguments decode(String rawArguments) {
        if (rawArguments == null || rawArguments.isBlank()) {
            throw new IllegalArgumentException("tool call arguments are empty");
        }
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(rawArguments);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("error unmarshaling tool call arguments: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("tool call arguments must be a JSON object");
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> field : root.properties()) {
            if (!field.getValue().isTextual()) {
                throw new IllegalArgumentException("tool call argument '%s' must be a string".formatted(field.getKey()));
            }
            values.put(field.getKey(), field.getValue().textValue());
        }
        return new ToolArguments(values);
    }

    String require(String name) {
        Objects.requireNonNull(name, "name");
        String value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("missing required argument '%s'".formatted(name));
        }
        return value;
    }

    Map<String, String> asMap() {
        return values;
    }
}
