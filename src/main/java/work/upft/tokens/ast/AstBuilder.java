package work.upft.tokens.ast;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.upft.tokens.io.JsonValues;
import work.upft.tokens.model.TokenType;
import work.upft.tokens.model.TypedValue;

/**
 * Builds token trees from nested DTCG documents.
 */
public final class AstBuilder {
    private static final Logger log = LoggerFactory.getLogger(AstBuilder.class);

    private AstBuilder() {}

    public static GroupNode build(Map<String, Object> document) {
        return build(document, null);
    }

    public static GroupNode build(Map<String, Object> document, TokenType inheritedType) {
        var root = new GroupNode("");
        populate(root, document == null ? Map.of() : document, inheritedType);
        return root;
    }

    public static FileAst buildFile(String filePath, Map<String, Object> document) {
        var file = new FileAst(filePath);
        var body = document == null ? Map.<String, Object>of() : document;
        populate(file, body, null);
        file.setChecksum(checksum(body));
        log.debug("Built AST for {}", filePath);
        return file;
    }

    private static void populate(GroupNode group, Map<String, Object> document, TokenType inheritedType) {
        var declared = typeOf(document.get("$type"), group.path());
        var groupType = declared != null ? declared : inheritedType;
        group.setTypes(groupType, declared);
        for (var entry : document.entrySet()) {
            var item = DocumentEntry.classify(entry.getKey(), entry.getValue());
            var childPath = AstNode.childPath(group.path(), item.key());
            switch (item.kind()) {
                case METADATA -> applyMetadata(group, item.key(), item.raw());
                case TOKEN -> group.addToken(item.key(), createToken(childPath, item.body(), groupType));
                case GROUP -> {
                    var child = new GroupNode(childPath);
                    populate(child, item.body(), groupType);
                    group.addGroup(item.key(), child);
                }
                case IGNORED -> log.debug("Ignoring non-object entry {}", childPath);
            }
        }
    }

    private static TokenNode createToken(String path, Map<String, Object> body, TokenType inheritedType) {
        var declared = typeOf(body.get("$type"), path);
        if (declared != null && inheritedType != null && declared != inheritedType) {
            throw new AstBuildException(path, "Type conflict: token declares " + declared + " but group type is " + inheritedType);
        }
        var type = declared != null ? declared : inheritedType;
        if (type == null) {
            throw new AstBuildException(path, "Untyped token");
        }
        var raw = body.containsKey("$value") ? body.get("$value") : body.get("$ref");
        var token = new TokenNode(path, type, declared, new TypedValue(type, raw), ReferenceParser.extract(body));
        applyMetadata(token, "$description", body.get("$description"));
        applyMetadata(token, "$extensions", body.get("$extensions"));
        return token;
    }

    private static TokenType typeOf(Object raw, String path) {
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof String name)) {
            throw new AstBuildException(path, "$type must be a string");
        }
        return TokenType.fromName(name)
            .orElseThrow(() -> new AstBuildException(path, "Unknown token type '" + name + "'"));
    }

    private static void applyMetadata(AstNode node, String key, Object value) {
        if (value == null) {
            return;
        }
        switch (key) {
            case "$description" -> node.metadata().put("description", value);
            case "$extensions" -> node.metadata().put("extensions", JsonValues.deepCopy(value));
            default -> {
                // $type is applied separately; other $-keys carry nothing for the tree
            }
        }
    }

    static String checksum(Map<String, Object> document) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            var bytes = digest.digest(JsonValues.toText(document).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
