package work.upft.tokens.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.upft.tokens.model.TokenReference;
import work.upft.tokens.model.TokenType;
import work.upft.tokens.model.TypedValue;

class ValueSubstitutionTest {
    private static final TokenReference PRIMARY = TokenReference.local("color.primary");
    private static final TypedValue BLUE = new TypedValue(TokenType.COLOR, "#00f");

    @Test
    void wholeValueIsReplaced() {
        var current = new TypedValue(TokenType.COLOR, "{color.primary}");
        assertEquals("#00f", ValueSubstitution.replace(current, PRIMARY, BLUE).value());
    }

    @Test
    void embeddedPatternsAreReplacedTextually() {
        var current = new TypedValue(TokenType.FONT_FAMILY, "{color.primary} and {color/primary} but not {color.secondary}");
        assertEquals("#00f and #00f but not {color.secondary}", ValueSubstitution.replace(current, PRIMARY, BLUE).value());
    }

    @Test
    void arraysAndNestedObjectsAreReplacedPerElement() {
        var gradient = new TypedValue(TokenType.GRADIENT, List.of(
            Map.of("color", "{color.primary}", "position", 0),
            Map.of("color", "#fff", "position", 1)
        ));
        var replaced = ValueSubstitution.replace(gradient, PRIMARY, BLUE);
        assertEquals(List.of(
            Map.of("color", "#00f", "position", 0),
            Map.of("color", "#fff", "position", 1)
        ), replaced.value());
    }

    @Test
    void refObjectsAreReplacedWhole() {
        var current = new TypedValue(TokenType.COLOR, Map.of("$ref", "#/color/primary"));
        assertEquals("#00f", ValueSubstitution.replace(current, PRIMARY, BLUE).value());
    }

    @Test
    void inputIsLeftUntouched() {
        var current = new TypedValue(TokenType.COLOR, "{color.primary}");
        ValueSubstitution.replace(current, PRIMARY, BLUE);
        assertEquals("{color.primary}", current.value());
    }
}
