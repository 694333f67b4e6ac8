package work.upft.tokens.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TokenReferenceTest {
    @Test
    void aliasSpellingsNormalizeToTheSameReference() {
        var dotted = TokenReference.parse("{color.primary}").orElseThrow();
        var slashed = TokenReference.parse("{color/primary}").orElseThrow();
        var pointer = TokenReference.parse("#/color/primary/$value").orElseThrow();

        assertEquals("{color.primary}", dotted.literal());
        assertEquals("color.primary", dotted.path());
        assertEquals(dotted, slashed);
        assertEquals(dotted, pointer);
        assertTrue(dotted.isLocal());
    }

    @Test
    void crossFileLiteralsKeepFileAndFragment() {
        var relative = TokenReference.parse("../base/colors.json#color.primary").orElseThrow();
        assertTrue(relative.isCrossFile());
        assertEquals("../base/colors.json", relative.file());
        assertEquals("color.primary", relative.path());
        assertEquals("../base/colors.json#color.primary", relative.key());

        var remote = TokenReference.parse("https://example.com/tokens.json#/spacing/base").orElseThrow();
        assertEquals("https://example.com/tokens.json", remote.file());
        assertEquals("spacing.base", remote.path());
    }

    @Test
    void plainValuesAreNotReferences() {
        assertFalse(TokenReference.parse("#ff0000").isPresent());
        assertFalse(TokenReference.parse("4px").isPresent());
        assertFalse(TokenReference.parse("1px solid {color.border}").isPresent());
        assertFalse(TokenReference.parse(null).isPresent());
    }

    @Test
    void placeholderDetection() {
        assertTrue(new TypedValue(TokenType.COLOR, "{color.base}").isReferencePlaceholder());
        assertTrue(new TypedValue(TokenType.COLOR, Map.of("$ref", "#/color/base")).isReferencePlaceholder());
        assertFalse(new TypedValue(TokenType.COLOR, "#fff").isReferencePlaceholder());
    }

    @Test
    void typedValueCopiesItsPayload() {
        var payload = new ArrayList<Object>(List.of("a"));
        var typed = new TypedValue(TokenType.FONT_FAMILY, payload);
        payload.add("b");
        assertEquals(List.of("a"), typed.value());
    }

    @Test
    void compositeTypes() {
        assertTrue(TokenType.TYPOGRAPHY.isComposite());
        assertFalse(TokenType.COLOR.isComposite());
        assertEquals(TokenType.CUBIC_BEZIER, TokenType.fromName("cubicBezier").orElseThrow());
        assertFalse(TokenType.fromName("colour").isPresent());
    }
}
