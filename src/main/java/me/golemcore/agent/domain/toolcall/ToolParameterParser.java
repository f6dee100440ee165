package me.golemcore.agent.domain.toolcall;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns parameter text into a string-keyed map. A JSON object is tried first,
 * then flat {@code key=value} pairs separated by commas. Unparseable text
 * yields an empty map, never an error.
 */
@Slf4j
public class ToolParameterParser {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    public ToolParameterParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public Map<String, Object> parse(String text) {
        if (text == null || text.isBlank()) {
            return new LinkedHashMap<>();
        }
        String trimmed = text.trim();
        JsonNode node = readObject(trimmed);
        if (node != null) {
            return toMap(node);
        }
        return parseKeyValuePairs(trimmed);
    }

    /**
     * Reads {@code text} as exactly one JSON object.
     *
     * @return the object node, or null when the text is not a single object
     */
    JsonNode readObject(String text) {
        if (text == null || !text.startsWith("{")) {
            return null;
        }
        try {
            JsonNode node = strictReader.readTree(text);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.trace("[ToolCall] Not a JSON object: {}", e.getOriginalMessage());
            return null;
        }
    }

    Map<String, Object> toMap(JsonNode objectNode) {
        Map<String, Object> map = objectMapper.convertValue(objectNode, MAP_TYPE);
        return map != null ? map : new LinkedHashMap<>();
    }

    private Map<String, Object> parseKeyValuePairs(String text) {
        Map<String, Object> params = new LinkedHashMap<>();
        for (String part : text.split(",")) {
            String[] kv = part.trim().split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            String key = kv[0].trim();
            if (key.isEmpty()) {
                continue;
            }
            params.put(key, kv[1].trim());
        }
        return params;
    }
}
