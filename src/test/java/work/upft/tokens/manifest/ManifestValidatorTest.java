package work.upft.tokens.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.upft.tokens.support.TokenTestSupport.doc;

import java.util.List;
import org.junit.jupiter.api.Test;

class ManifestValidatorTest {
    private final Manifest manifest = ManifestParser.parse(doc(
        "sets", List.of(doc("values", List.of("base.json"))),
        "modifiers", doc(
            "theme", doc("oneOf", List.of("light", "dark"), "values", doc("light", List.of("l.json"), "dark", List.of("d.json"))),
            "colors", doc("anyOf", List.of("red", "green", "blue"), "values", doc("red", List.of("r.json")))
        )
    ));

    @Test
    void acceptsValidSelections() {
        assertTrue(ManifestValidator.validateInput(manifest, doc("colors", List.of("red", "blue"))).valid());
        assertTrue(ManifestValidator.validateInput(manifest, doc("theme", "dark", "output", "x.json")).valid());
        assertTrue(ManifestValidator.validateInput(manifest, doc()).valid());
    }

    @Test
    void namesTheInvalidAnyOfValue() {
        var result = ManifestValidator.validateInput(manifest, doc("colors", List.of("yellow")));
        assertEquals(1, result.errors().size());
        var error = result.errors().get(0);
        assertEquals("colors", error.modifier());
        assertEquals("yellow", error.received());
        assertTrue(error.message().contains("yellow"));
    }

    @Test
    void reportsEveryProblem() {
        var result = ManifestValidator.validateInput(manifest, doc(
            "theme", List.of("light"),
            "colors", List.of("red", 3, "pink"),
            "size", "large"
        ));
        assertEquals(4, result.errors().size());
        assertEquals("oneOf modifier expects a single string value, got array", result.errors().get(0).message());
        assertTrue(result.errors().get(1).message().startsWith("anyOf modifier array must contain only strings"));
        assertTrue(result.errors().get(2).message().contains("pink"));
        assertEquals("Unknown modifier", result.errors().get(3).message());
        assertEquals("one of: theme, colors", result.errors().get(3).expected());
    }

    @Test
    void anyOfRequiresAnArray() {
        var result = ManifestValidator.validateInput(manifest, doc("colors", "red"));
        assertEquals("anyOf modifier expects an array of strings, got string", result.errors().get(0).message());
    }
}
