package work.upft.tokens.ast;

import java.util.LinkedHashMap;
import java.util.Map;
import work.upft.tokens.io.JsonValues;

/**
 * Writes a tree back to a nested document.
 */
public final class AstFlattener {
    private AstFlattener() {}

    /**
     * @param useResolved write resolved values where a token has one
     */
    public static Map<String, Object> toDocument(GroupNode root, boolean useResolved) {
        return toDocument(root, useResolved, false);
    }

    /**
     * @param alwaysType emit {@code $type} on every token, not only where it was declared
     */
    public static Map<String, Object> toDocument(GroupNode root, boolean useResolved, boolean alwaysType) {
        var document = new LinkedHashMap<String, Object>();
        writeGroupMetadata(root, document);
        writeChildren(root, document, useResolved, alwaysType);
        return document;
    }

    private static void writeChildren(GroupNode group, Map<String, Object> target, boolean useResolved, boolean alwaysType) {
        group.children().forEach((key, node) -> {
            if (node instanceof TokenNode token) {
                target.put(key, writeToken(token, useResolved, alwaysType));
            } else if (node instanceof GroupNode child) {
                var map = new LinkedHashMap<String, Object>();
                writeGroupMetadata(child, map);
                writeChildren(child, map, useResolved, alwaysType);
                target.put(key, map);
            }
        });
    }

    private static void writeGroupMetadata(GroupNode group, Map<String, Object> target) {
        group.declaredType().ifPresent(type -> target.put("$type", type.wireName()));
        writeMetadata(group, target);
    }

    private static Map<String, Object> writeToken(TokenNode token, boolean useResolved, boolean alwaysType) {
        var map = new LinkedHashMap<String, Object>();
        if (alwaysType) {
            map.put("$type", token.type().wireName());
        } else {
            token.declaredType().ifPresent(type -> map.put("$type", type.wireName()));
        }
        var value = useResolved ? token.effectiveValue() : token.typedValue();
        map.put("$value", JsonValues.deepCopy(value.value()));
        writeMetadata(token, map);
        return map;
    }

    private static void writeMetadata(AstNode node, Map<String, Object> target) {
        var description = node.metadata().get("description");
        if (description != null) {
            target.put("$description", description);
        }
        var extensions = node.metadata().get("extensions");
        if (extensions != null) {
            target.put("$extensions", JsonValues.deepCopy(extensions));
        }
    }
}
