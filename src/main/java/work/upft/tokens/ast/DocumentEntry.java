package work.upft.tokens.ast;

import java.util.Map;
import work.upft.tokens.io.JsonValues;

/**
 * One entry of a raw token document, classified once before the tree is built.
 */
public record DocumentEntry(Kind kind, String key, Object raw) {
    public enum Kind {
        TOKEN,
        GROUP,
        METADATA,
        IGNORED
    }

    public static DocumentEntry classify(String key, Object value) {
        if (key.startsWith("$")) {
            return new DocumentEntry(Kind.METADATA, key, value);
        }
        if (JsonValues.isToken(value) || isReferenceToken(value)) {
            return new DocumentEntry(Kind.TOKEN, key, value);
        }
        if (JsonValues.isObject(value)) {
            return new DocumentEntry(Kind.GROUP, key, value);
        }
        return new DocumentEntry(Kind.IGNORED, key, value);
    }

    // {"$ref": "..."} with only $-prefixed siblings stands for a token whose value is the reference
    private static boolean isReferenceToken(Object value) {
        if (!(value instanceof Map<?, ?> map) || !(map.get("$ref") instanceof String)) {
            return false;
        }
        return map.keySet().stream().allMatch(k -> String.valueOf(k).startsWith("$"));
    }

    public Map<String, Object> body() {
        return JsonValues.asObject(raw);
    }
}
