package com.boolparser.variable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.HashMap;
import java.util.Map;

/**
 * Factory for creating a SymbolTable from a JSON object.
 * Nested JSON objects are flattened using dot notation (e.g., {"x":{"y":true}} becomes "x.y" -> true),
 * which matches the identifier alphabet of the lexer.
 */
public final class SymbolTableFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private SymbolTableFactory() {
    }

    /**
     * Create a SymbolTable from a JSON object.
     *
     * @param json JSON object text; null or blank gives an empty table
     * @return Table holding the flattened bindings
     */
    public static SymbolTable fromJson(String json) {
        if (json == null || json.isBlank()) {
            return SymbolTable.empty();
        }
        return SymbolTable.of(flatten(parseJson(json)));
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON symbol table: " + e.getOriginalMessage(), e);
        }
    }

    private static Map<String, Object> flatten(Map<String, Object> map) {
        Map<String, Object> result = new HashMap<>();
        flattenRecursive("", map, result);
        return result;
    }

    @SuppressWarnings("unchecked")
    private static void flattenRecursive(String prefix, Map<String, Object> map, Map<String, Object> result) {
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object value = entry.getValue();

            if (value instanceof Map) {
                flattenRecursive(key, (Map<String, Object>) value, result);
            } else {
                // Lists and nulls are kept as-is and fail as a type mismatch if referenced
                result.put(key, value);
            }
        }
    }
}
