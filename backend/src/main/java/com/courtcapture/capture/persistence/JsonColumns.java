package com.courtcapture.capture.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Jackson bridge for JSON stored in text columns.
 */
@Component
public class JsonColumns {
    static final TypeReference<List<Long>> LONG_LIST = new TypeReference<>() {};
    static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public JsonColumns(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize JSON column", e);
        }
    }

    public JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed JSON column: " + e.getOriginalMessage(), e);
        }
    }

    public <T> T read(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed JSON column: " + e.getOriginalMessage(), e);
        }
    }
}
