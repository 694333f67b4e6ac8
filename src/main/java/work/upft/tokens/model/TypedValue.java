package work.upft.tokens.model;

import java.util.Map;
import java.util.Objects;
import work.upft.tokens.io.JsonValues;

/**
 * A token value tagged with its effective type. The payload is copied on construction.
 */
public record TypedValue(TokenType type, Object value) {
    public TypedValue {
        Objects.requireNonNull(type, "type");
        value = JsonValues.deepCopy(value);
    }

    public TypedValue withValue(Object newValue) {
        return new TypedValue(type, newValue);
    }

    /**
     * True when the whole payload is still an unsubstituted reference literal.
     */
    public boolean isReferencePlaceholder() {
        if (value instanceof String text) {
            return TokenReference.parse(text).isPresent();
        }
        if (value instanceof Map<?, ?> map && map.size() == 1 && map.get("$ref") instanceof String ref) {
            return TokenReference.parse(ref).isPresent();
        }
        return false;
    }
}
