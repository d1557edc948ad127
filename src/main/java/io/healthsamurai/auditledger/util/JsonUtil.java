package io.healthsamurai.auditledger.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Map;

/**
 * Utility class for JSON operations using Jackson.
 */
public final class JsonUtil {

    // java.time values are written as ISO-8601 strings
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    // Map keys sorted at every level so equal content always yields equal bytes
    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private JsonUtil() {
        // Utility class
    }

    /**
     * Creates a new empty ObjectNode.
     *
     * @return A new ObjectNode
     */
    public static ObjectNode createObjectNode() {
        return OBJECT_MAPPER.createObjectNode();
    }

    /**
     * Converts an object to JSON string.
     *
     * @param object The object to serialize
     * @return JSON string
     * @throws JsonProcessingException if serialization fails
     */
    public static String toJson(Object object) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsString(object);
    }

    /**
     * Converts an object to pretty-printed JSON string.
     * Uses Jackson's default pretty printer with 2-space indentation.
     *
     * @param object The object to serialize
     * @return Pretty-printed JSON string
     * @throws JsonProcessingException if serialization fails
     */
    public static String toPrettyJson(Object object) throws JsonProcessingException {
        return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(object);
    }

    /**
     * Serializes a map-based structure with keys sorted at every nesting level and no whitespace.
     *
     * @param value Maps, lists and JSON scalars
     * @return Canonical JSON string
     * @throws JsonProcessingException if serialization fails
     */
    public static String toCanonicalJson(Map<String, ?> value) throws JsonProcessingException {
        return CANONICAL_MAPPER.writeValueAsString(value);
    }

    /**
     * Converts arbitrary values into plain JSON types (maps, lists, strings, numbers, booleans).
     *
     * @param value Free-form map
     * @return A map holding only JSON types
     * @throws IllegalArgumentException if a value cannot be represented as JSON
     */
    public static Map<String, Object> toJsonMap(Map<String, ?> value) {
        return OBJECT_MAPPER.convertValue(value, MAP_TYPE);
    }

    /**
     * Converts a JSON object node into a plain map.
     */
    public static Map<String, Object> toJsonMap(JsonNode node) {
        return OBJECT_MAPPER.convertValue(node, MAP_TYPE);
    }

    /**
     * Converts a value into a JSON tree.
     */
    public static JsonNode toTree(Object value) {
        return OBJECT_MAPPER.valueToTree(value);
    }

    /**
     * Parses a JSON string into a JsonNode.
     *
     * @param json JSON string
     * @return JsonNode or null if parsing fails
     */
    public static JsonNode parseJson(String json) {
        if (json == null || json.trim().isEmpty()) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
