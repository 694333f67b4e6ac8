package work.upft.tokens.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.upft.tokens.support.TokenTestSupport.doc;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ManifestParserTest {
    @Test
    void parsesSetsModifiersAndGenerateEntries() {
        var manifest = ManifestParser.parse(doc(
            "name", "brand",
            "sets", List.of(doc("name", "core", "values", List.of("core.json")), doc("files", List.of("extra.json"))),
            "modifiers", doc(
                "theme", doc("oneOf", List.of("light", "dark"), "values", doc("light", List.of("l.json"), "dark", List.of("d.json"), "*", List.of("all.json"))),
                "features", doc("anyOf", List.of("a", "b"), "values", doc("a", List.of("a.json")))
            ),
            "generate", List.of(doc("theme", "*", "output", "out.json", "excludeSets", List.of("core"))),
            "options", doc("resolveReferences", true)
        ));

        assertEquals(Optional.of("brand"), manifest.name());
        assertEquals(2, manifest.sets().size());
        assertEquals(List.of("extra.json"), manifest.sets().get(1).files());
        var theme = manifest.modifier("theme").orElseThrow();
        assertTrue(theme.isOneOf());
        assertEquals(List.of("l.json", "all.json"), theme.filesFor("light"));
        assertTrue(manifest.modifier("features").orElseThrow().isAnyOf());
        var spec = manifest.generate().get(0);
        assertEquals("*", spec.selections().get("theme"));
        assertEquals(Optional.of("out.json"), spec.output());
        assertEquals(Optional.of(List.of("core")), spec.excludeSets());
        assertTrue(manifest.options().resolveReferences());
    }

    @Test
    void collectsEveryShapeProblem() {
        var ex = assertThrows(ManifestException.class, () -> ManifestParser.parse(doc(
            "sets", List.of(),
            "modifiers", doc(
                "both", doc("oneOf", List.of("x"), "anyOf", List.of("y"), "values", doc()),
                "noValues", doc("oneOf", List.of("x")),
                "stray", doc("oneOf", List.of("x"), "values", doc("z", List.of("z.json")))
            ),
            "generate", "all"
        )));

        assertEquals(5, ex.problems().size());
        assertTrue(ex.getMessage().startsWith("Invalid manifest:"));
        assertTrue(ex.problems().contains("sets: must be a non-empty array"));
        assertTrue(ex.problems().contains("modifiers.stray.values.z: is not one of the declared options"));
    }

    @Test
    void defaultMustBeADeclaredOption() {
        var ex = assertThrows(ManifestException.class, () -> ManifestParser.parse(doc(
            "sets", List.of(doc("values", List.of("a.json"))),
            "modifiers", doc("theme", doc("oneOf", List.of("light"), "default", "dark", "values", doc("light", List.of()))))
        ));
        assertEquals(List.of("modifiers.theme.default: 'dark' is not one of the declared options"), ex.problems());
    }
}
