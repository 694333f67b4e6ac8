package work.upft.tokens.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.upft.tokens.model.TokenReference;
import work.upft.tokens.model.TokenType;
import work.upft.tokens.model.TypedValue;

public final class TokenNode extends AstNode {
    private final TokenType type;
    private final TokenType declaredType;
    private final TypedValue typedValue;
    private final List<TokenReference> references;
    private boolean resolved;
    private TypedValue resolvedValue;

    public TokenNode(String path, TokenType type, TokenType declaredType, TypedValue typedValue, List<TokenReference> references) {
        super(path);
        this.type = Objects.requireNonNull(type, "type");
        this.declaredType = declaredType;
        this.typedValue = Objects.requireNonNull(typedValue, "typedValue");
        this.references = references == null ? List.of() : List.copyOf(references);
        if (this.references.isEmpty()) {
            this.resolved = true;
            this.resolvedValue = typedValue;
        }
    }

    @Override
    public boolean isToken() {
        return true;
    }

    public TokenType type() {
        return type;
    }

    /**
     * The {@code $type} written on the token itself, if any.
     */
    public Optional<TokenType> declaredType() {
        return Optional.ofNullable(declaredType);
    }

    public TypedValue typedValue() {
        return typedValue;
    }

    public List<TokenReference> references() {
        return references;
    }

    public boolean hasReferences() {
        return !references.isEmpty();
    }

    public boolean hasCrossFileReferences() {
        return references.stream().anyMatch(TokenReference::isCrossFile);
    }

    public List<TokenReference> crossFileReferences() {
        return references.stream().filter(TokenReference::isCrossFile).toList();
    }

    public boolean isResolved() {
        return resolved;
    }

    public Optional<TypedValue> resolvedValue() {
        return Optional.ofNullable(resolvedValue);
    }

    /**
     * Resolved value if any, otherwise the value as written.
     */
    public TypedValue effectiveValue() {
        return resolvedValue != null ? resolvedValue : typedValue;
    }

    public void markResolved(TypedValue value) {
        this.resolvedValue = Objects.requireNonNull(value, "value");
        this.resolved = true;
    }
}
