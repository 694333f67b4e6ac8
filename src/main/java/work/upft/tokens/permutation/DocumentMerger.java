package work.upft.tokens.permutation;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.upft.tokens.io.JsonValues;
import work.upft.tokens.model.TokenType;

/**
 * Right-biased deep merge of token documents. Inputs are never modified.
 */
public final class DocumentMerger {
    private DocumentMerger() {}

    public static Map<String, Object> mergeAll(List<Map<String, Object>> documents) {
        Map<String, Object> result = JsonValues.copyObject(null);
        for (Map<String, Object> document : documents) {
            result = merge(result, document);
        }
        return result;
    }

    public static Map<String, Object> merge(Map<String, Object> left, Map<String, Object> right) {
        return mergeGroups(JsonValues.copyObject(left), right, "", null);
    }

    private static Map<String, Object> mergeGroups(Map<String, Object> result, Map<String, Object> right, String path, String inheritedType) {
        var groupType = firstString(right.get("$type"), result.get("$type"), inheritedType);
        for (var entry : right.entrySet()) {
            var key = entry.getKey();
            var incoming = entry.getValue();
            var existing = result.get(key);
            var childPath = path.isEmpty() ? key : path + "." + key;
            if (key.startsWith("$")) {
                result.put(key, mergeMetadata(key, existing, incoming));
            } else if (JsonValues.isToken(existing) && JsonValues.isToken(incoming)) {
                result.put(key, mergeTokens(JsonValues.asObject(existing), JsonValues.asObject(incoming), childPath, groupType));
            } else if (JsonValues.isGroup(existing) && JsonValues.isGroup(incoming)) {
                result.put(key, mergeGroups(JsonValues.asObject(existing), JsonValues.asObject(incoming), childPath, groupType));
            } else {
                result.put(key, JsonValues.deepCopy(incoming));
            }
        }
        return result;
    }

    private static Map<String, Object> mergeTokens(Map<String, Object> existing, Map<String, Object> incoming, String path, String inheritedType) {
        var leftType = existing.get("$type");
        var rightType = incoming.get("$type");
        if (leftType != null && rightType != null && !Objects.equals(leftType, rightType)) {
            throw new MergeConflictException(path, "Conflicting $type " + leftType + " and " + rightType);
        }
        var type = firstString(rightType, leftType, inheritedType);
        for (var entry : incoming.entrySet()) {
            var key = entry.getKey();
            var current = existing.get(key);
            var value = entry.getValue();
            if ("$value".equals(key) && TokenType.isCompositeName(type) && JsonValues.isObject(current) && JsonValues.isObject(value)) {
                existing.put(key, deepMergeObjects(JsonValues.asObject(current), JsonValues.asObject(value)));
            } else {
                existing.put(key, mergeMetadata(key, current, value));
            }
        }
        return existing;
    }

    private static Object mergeMetadata(String key, Object existing, Object incoming) {
        if ("$extensions".equals(key) && JsonValues.isObject(existing) && JsonValues.isObject(incoming)) {
            return deepMergeObjects(JsonValues.asObject(existing), JsonValues.asObject(incoming));
        }
        return JsonValues.deepCopy(incoming);
    }

    private static Map<String, Object> deepMergeObjects(Map<String, Object> existing, Map<String, Object> incoming) {
        for (var entry : incoming.entrySet()) {
            var current = existing.get(entry.getKey());
            if (JsonValues.isObject(current) && JsonValues.isObject(entry.getValue())) {
                existing.put(entry.getKey(), deepMergeObjects(JsonValues.asObject(current), JsonValues.asObject(entry.getValue())));
            } else {
                existing.put(entry.getKey(), JsonValues.deepCopy(entry.getValue()));
            }
        }
        return existing;
    }

    private static String firstString(Object... candidates) {
        for (Object candidate : candidates) {
            if (candidate instanceof String text) {
                return text;
            }
        }
        return null;
    }
}
