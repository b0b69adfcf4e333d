package com.nayem.strata.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Renders typed documents and payloads to their JSON wire shape.
 */
public class DocumentCodec {

    private final ObjectMapper objectMapper;

    public DocumentCodec() {
        this(defaultMapper());
    }

    public DocumentCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * The mapper used for every document: absent fields are omitted, unknown
     * fields are ignored and timestamps are written as ISO-8601.
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public ObjectMapper mapper() {
        return objectMapper;
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public JsonNode toTree(Object value) {
        return objectMapper.valueToTree(value);
    }

    public <T> T fromTree(JsonNode tree, Class<T> type) {
        try {
            return objectMapper.treeToValue(tree, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to read " + type.getSimpleName(), e);
        }
    }
}
