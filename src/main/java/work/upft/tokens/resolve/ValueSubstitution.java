package work.upft.tokens.resolve;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.upft.tokens.ast.ReferenceParser;
import work.upft.tokens.io.JsonValues;
import work.upft.tokens.model.TokenReference;
import work.upft.tokens.model.TypedValue;

/**
 * Replaces occurrences of one reference inside a token value.
 *
 * <p>Occurrences are matched by normalized reference, so {@code {a/b}} and {@code {a.b}} are both
 * replaced by a substitution for {@code a.b}. The input value is never modified.
 */
public final class ValueSubstitution {
    private ValueSubstitution() {}

    public static TypedValue replace(TypedValue current, TokenReference reference, TypedValue replacement) {
        return current.withValue(replaceIn(current.value(), reference, replacement.value()));
    }

    static Object replaceIn(Object value, TokenReference reference, Object replacement) {
        if (value instanceof String text) {
            if (matches(text, reference)) {
                return JsonValues.deepCopy(replacement);
            }
            return reference.isLocal() ? replaceEmbedded(text, reference, replacement) : text;
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            for (Object item : list) {
                copy.add(replaceIn(item, reference, replacement));
            }
            return copy;
        }
        if (value instanceof Map<?, ?> map) {
            if (map.get("$ref") instanceof String ref && matches(ref, reference)) {
                return JsonValues.deepCopy(replacement);
            }
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), replaceIn(entry.getValue(), reference, replacement));
            }
            return copy;
        }
        return value;
    }

    private static boolean matches(String text, TokenReference reference) {
        Optional<TokenReference> parsed = TokenReference.parse(text);
        return parsed.isPresent() && parsed.get().equals(reference);
    }

    private static String replaceEmbedded(String text, TokenReference reference, Object replacement) {
        var matcher = ReferenceParser.EMBEDDED_ALIAS.matcher(text);
        var out = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            if (TokenReference.local(matcher.group(1)).equals(reference)) {
                out.append(text, last, matcher.start()).append(JsonValues.toText(replacement));
                last = matcher.end();
            }
        }
        return out.append(text.substring(last)).toString();
    }
}
