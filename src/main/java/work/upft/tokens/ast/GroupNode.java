package work.upft.tokens.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.upft.tokens.model.TokenType;

/**
 * A group of tokens and nested groups. Children keep document order.
 */
public class GroupNode extends AstNode {
    private final Map<String, AstNode> children = new LinkedHashMap<>();
    private final Map<String, TokenNode> tokens = new LinkedHashMap<>();
    private final Map<String, GroupNode> groups = new LinkedHashMap<>();
    private TokenType groupType;
    private TokenType declaredType;

    public GroupNode(String path) {
        super(path);
    }

    @Override
    public boolean isToken() {
        return false;
    }

    public Map<String, AstNode> children() {
        return Collections.unmodifiableMap(children);
    }

    public Map<String, TokenNode> tokens() {
        return Collections.unmodifiableMap(tokens);
    }

    public Map<String, GroupNode> groups() {
        return Collections.unmodifiableMap(groups);
    }

    public Optional<AstNode> child(String key) {
        return Optional.ofNullable(children.get(key));
    }

    public void addToken(String key, TokenNode token) {
        children.put(key, token);
        tokens.put(key, token);
    }

    public void addGroup(String key, GroupNode group) {
        children.put(key, group);
        groups.put(key, group);
    }

    /**
     * Type applied to untyped descendants, declared here or inherited.
     */
    public Optional<TokenType> groupType() {
        return Optional.ofNullable(groupType);
    }

    public Optional<TokenType> declaredType() {
        return Optional.ofNullable(declaredType);
    }

    void setTypes(TokenType effective, TokenType declared) {
        this.groupType = effective;
        this.declaredType = declared;
    }

    void adoptChildren(GroupNode other) {
        setTypes(other.groupType, other.declaredType);
        metadata().putAll(other.metadata());
        other.children.forEach((key, node) -> {
            if (node instanceof TokenNode token) {
                addToken(key, token);
            } else if (node instanceof GroupNode group) {
                addGroup(key, group);
            }
        });
    }
}
