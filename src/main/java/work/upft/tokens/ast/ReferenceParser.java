package work.upft.tokens.ast;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import work.upft.tokens.model.TokenReference;

/**
 * Extracts the references a token body points to.
 */
public final class ReferenceParser {
    public static final Pattern EMBEDDED_ALIAS = Pattern.compile("\\{([^{}]+)}");

    private ReferenceParser() {}

    /**
     * References in {@code $ref} and anywhere in {@code $value}, duplicates collapsed in first-seen order.
     */
    public static List<TokenReference> extract(Map<String, Object> token) {
        var refs = new LinkedHashSet<TokenReference>();
        if (token.get("$ref") instanceof String ref) {
            TokenReference.parse(ref).ifPresent(refs::add);
        }
        if (token.containsKey("$value")) {
            collect(token.get("$value"), refs);
        }
        return List.copyOf(refs);
    }

    private static void collect(Object value, Set<TokenReference> refs) {
        if (value instanceof String text) {
            var whole = TokenReference.parse(text);
            if (whole.isPresent()) {
                refs.add(whole.get());
                return;
            }
            var matcher = EMBEDDED_ALIAS.matcher(text);
            while (matcher.find()) {
                refs.add(TokenReference.local(matcher.group(1)));
            }
        } else if (value instanceof List<?> list) {
            for (Object item : list) {
                collect(item, refs);
            }
        } else if (value instanceof Map<?, ?> map) {
            for (Object item : map.values()) {
                collect(item, refs);
            }
        }
    }
}
