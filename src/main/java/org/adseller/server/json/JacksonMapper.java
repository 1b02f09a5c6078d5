package org.adseller.server.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class JacksonMapper {

    private static final String FAILED_TO_DECODE = "Failed to decode: %s";
    private static final String KEY_SEPARATOR = ".";

    private final ObjectMapper mapper;

    public JacksonMapper(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public <T> String encodeToString(T obj) throws EncodeException {
        try {
            return mapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new EncodeException("Failed to encode as JSON: " + e.getMessage());
        }
    }

    public <T> T decodeValue(String str, Class<T> clazz) throws DecodeException {
        try {
            return mapper.readValue(str, clazz);
        } catch (JsonProcessingException e) {
            throw new DecodeException(String.format(FAILED_TO_DECODE, e.getMessage()), e);
        }
    }

    /**
     * Converts given value to a single-level map. Nested objects are inlined with dot-separated keys,
     * arrays are kept as lists of plain values.
     */
    public Map<String, Object> encodeToFlatMap(Object value) throws EncodeException {
        final JsonNode tree;
        try {
            tree = mapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new EncodeException("Failed to encode as flat map: " + e.getMessage(), e);
        }

        if (tree == null || !tree.isObject()) {
            throw new EncodeException("Failed to encode as flat map: value is not an object");
        }

        final Map<String, Object> result = new LinkedHashMap<>();
        flatten(null, tree, result);
        return result;
    }

    private void flatten(String prefix, JsonNode node, Map<String, Object> result) {
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            final String key = prefix == null ? field.getKey() : prefix + KEY_SEPARATOR + field.getKey();
            final JsonNode fieldValue = field.getValue();

            if (fieldValue.isObject()) {
                flatten(key, fieldValue, result);
            } else if (fieldValue.isArray()) {
                result.put(key, mapper.convertValue(fieldValue, List.class));
            } else {
                result.put(key, mapper.convertValue(fieldValue, Object.class));
            }
        }
    }
}
