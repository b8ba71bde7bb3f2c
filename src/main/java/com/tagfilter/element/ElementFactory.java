package com.tagfilter.element;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Factory for creating Elements from JSON.
 * <p>
 * Expected shape: {@code {"type": "way", "id": 42, "tags": {"highway": "residential", "lanes": 2}}}.
 * Tag values of any JSON type are converted to strings.
 */
public class ElementFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private ElementFactory() {
    }

    /**
     * Create an Element from a JSON object.
     *
     * @param json JSON string
     * @return Parsed element
     * @throws IllegalArgumentException if the JSON is invalid or has no valid type
     */
    public static Element fromJson(String json) {
        Map<String, Object> parsed = parseJson(json);

        Object type = parsed.get("type");
        if (type == null) {
            throw new IllegalArgumentException("Element JSON requires a 'type'");
        }

        Element.Builder builder = Element.builder()
                .type(ElementType.fromName(type.toString()));

        Object id = parsed.get("id");
        if (id instanceof Number number) {
            builder.id(number.longValue());
        } else if (id != null) {
            builder.id(Long.parseLong(id.toString()));
        }

        Object tags = parsed.get("tags");
        if (tags instanceof Map<?, ?> tagMap) {
            for (Map.Entry<?, ?> entry : tagMap.entrySet()) {
                if (entry.getValue() != null) {
                    builder.tag(entry.getKey().toString(), entry.getValue().toString());
                }
            }
        } else if (tags != null) {
            throw new IllegalArgumentException("Element 'tags' must be a JSON object");
        }

        return builder.build();
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid element JSON: " + e.getMessage(), e);
        }
    }
}
