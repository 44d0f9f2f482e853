package com.signalrelay.core.util;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson mapper and helpers.
 * <p>
 * {@link #parseTree(String)} is strict: trailing content after the first JSON
 * value is rejected, matching what a browser's {@code JSON.parse} would do.
 * </p>
 */
public final class JsonUtils {
    private JsonUtils() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final ObjectReader STRICT_TREE_READER = MAPPER.reader()
        .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String writeValueAsString(Object object) {
        try {
            return mapper().writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + object.getClass().getSimpleName(), e);
        }
    }

    public static <T> T readValue(String json, Class<T> clazz) {
        try {
            return mapper().readValue(json, clazz);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON for " + clazz.getSimpleName(), e);
        }
    }

    public static <T> T readValue(String json, TypeReference<T> type) {
        try {
            return mapper().readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON", e);
        }
    }

    /**
     * Parses a single JSON document into a tree.
     *
     * @param json raw text
     * @return parsed node, never {@code null}
     * @throws JsonProcessingException if the text is empty, malformed or has trailing tokens
     */
    public static JsonNode parseTree(String json) throws JsonProcessingException {
        JsonNode node = STRICT_TREE_READER.readTree(json);
        if (node == null || node.isMissingNode()) {
            throw new JsonParseException(null, "No JSON content");
        }
        return node;
    }

}
