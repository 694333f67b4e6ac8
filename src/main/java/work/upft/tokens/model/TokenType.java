package work.upft.tokens.model;

import java.util.Optional;

/**
 * The closed set of DTCG token types understood by the AST.
 */
public enum TokenType {
    COLOR("color", false),
    DIMENSION("dimension", false),
    DURATION("duration", false),
    NUMBER("number", false),
    FONT_FAMILY("fontFamily", false),
    FONT_WEIGHT("fontWeight", false),
    CUBIC_BEZIER("cubicBezier", false),
    STROKE_STYLE("strokeStyle", true),
    BORDER("border", true),
    TRANSITION("transition", true),
    SHADOW("shadow", true),
    GRADIENT("gradient", true),
    TYPOGRAPHY("typography", true);

    private final String wireName;
    private final boolean composite;

    TokenType(String wireName, boolean composite) {
        this.wireName = wireName;
        this.composite = composite;
    }

    /**
     * Name used for {@code $type} in token documents.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Composite values are objects whose fields merge independently.
     */
    public boolean isComposite() {
        return composite;
    }

    public static Optional<TokenType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        for (TokenType type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static boolean isCompositeName(String name) {
        return fromName(name).map(TokenType::isComposite).orElse(false);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
