package work.upft.tokens.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the plain {@code Map}/{@code List} trees that token documents are parsed into.
 */
public final class JsonValues {
    private static final ObjectMapper JSON = new ObjectMapper();

    private JsonValues() {}

    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        return value;
    }

    /**
     * Deep copy whose maps and lists reject modification at every level.
     */
    public static Object frozenCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), frozenCopy(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(frozenCopy(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> frozenObject(Map<String, Object> value) {
        return value == null ? Map.of() : (Map<String, Object>) frozenCopy(value);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> copyObject(Map<String, Object> value) {
        return value == null ? new LinkedHashMap<>() : (Map<String, Object>) deepCopy(value);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asObject(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
    }

    public static boolean isObject(Object value) {
        return value instanceof Map<?, ?>;
    }

    /**
     * A token is an object carrying {@code $value}.
     */
    public static boolean isToken(Object value) {
        return value instanceof Map<?, ?> map && map.containsKey("$value");
    }

    public static boolean isGroup(Object value) {
        return value instanceof Map<?, ?> && !isToken(value);
    }

    public static String typeName(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof List<?>) {
            return "array";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        return "string";
    }

    /**
     * Renders a value inside a longer string; objects and arrays are written as compact JSON.
     */
    public static String toText(Object value) {
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            try {
                return JSON.writeValueAsString(value);
            } catch (JsonProcessingException ex) {
                throw new IllegalStateException("Cannot render value as JSON", ex);
            }
        }
        return String.valueOf(value);
    }

    static Map<String, Object> toMap(JsonNode node, String source) throws IOException {
        if (node == null || !node.isObject()) {
            throw new IOException("Document root must be an object: " + source);
        }
        @SuppressWarnings("unchecked")
        var map = (Map<String, Object>) convertNode(node);
        return map;
    }

    static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
