package work.upft.tokens.permutation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.upft.tokens.support.TokenTestSupport.doc;
import static work.upft.tokens.support.TokenTestSupport.token;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.upft.tokens.io.FileSystemTokenReader;
import work.upft.tokens.io.TokenFileReader;
import work.upft.tokens.manifest.Manifest;
import work.upft.tokens.manifest.ManifestException;
import work.upft.tokens.manifest.ManifestParser;
import work.upft.tokens.support.TokenTestSupport;

class PermutationResolverTest {
    private FileSystemTokenReader reader;
    private Manifest manifest;
    private PermutationResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        reader = new FileSystemTokenReader(TokenTestSupport.projectDir("theme"));
        manifest = ManifestParser.parse(reader.read("manifest.json"));
        resolver = new PermutationResolver(reader);
    }

    @Test
    void emptyInputUsesSetsOnly() throws IOException {
        var permutation = resolver.resolvePermutation(manifest, Map.of());
        assertEquals("default", permutation.id());
        assertEquals(List.of("tokens/base.json"), permutation.files());
        assertTrue(permutation.resolvedTokens().isPresent());
    }

    @Test
    void oneOfSelectionAddsItsFiles() throws IOException {
        var permutation = resolver.resolvePermutation(manifest, doc("theme", "light"));
        assertEquals("theme-light", permutation.id());
        assertEquals(List.of("tokens/base.json", "tokens/light.json"), permutation.files());

        var semantic = (Map<?, ?>) permutation.resolvedTokens().orElseThrow().get("semantic");
        assertEquals("#ffffff", ((Map<?, ?>) semantic.get("background")).get("$value"));
        var unresolved = (Map<?, ?>) permutation.tokens().get("semantic");
        assertEquals("{color.white}", ((Map<?, ?>) unresolved.get("background")).get("$value"));
    }

    @Test
    void modifierFilesFollowManifestThenSelectionOrder() throws IOException {
        var permutation = resolver.resolvePermutation(manifest, doc("colors", List.of("blue", "red"), "theme", "dark", "output", "dist/dark.json"));
        assertEquals("colors-blue+red_theme-dark", permutation.id());
        assertEquals(List.of("tokens/base.json", "tokens/dark.json", "tokens/blue.json", "tokens/red.json"), permutation.files());
        assertEquals(Optional.of("dist/dark.json"), permutation.output());
        assertTrue(((Map<?, ?>) permutation.tokens().get("accent")).containsKey("red"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void returnedPermutationsCannotBeModified() throws IOException {
        var permutation = resolver.resolvePermutation(manifest, doc("theme", "light", "colors", List.of("red")));

        var semantic = (Map<String, Object>) permutation.tokens().get("semantic");
        var background = (Map<String, Object>) semantic.get("background");
        var colors = (List<Object>) permutation.input().get("colors");
        assertThrows(UnsupportedOperationException.class, () -> permutation.resolvedTokens().orElseThrow().put("x", 1));
        assertThrows(UnsupportedOperationException.class, () -> background.put("$value", "#000"));
        assertThrows(UnsupportedOperationException.class, () -> colors.add("blue"));
        assertThrows(UnsupportedOperationException.class, () -> permutation.files().clear());
    }

    @Test
    void invalidInputIsRejectedWithEveryProblem() {
        var ex = assertThrows(ManifestException.class,
            () -> resolver.resolvePermutation(manifest, doc("theme", "sepia", "colors", List.of("yellow"))));
        assertTrue(ex.getMessage().startsWith("Invalid input:"));
        assertEquals(2, ex.problems().size());
        assertTrue(ex.problems().get(0).startsWith("theme: "));
    }

    @Test
    void unresolvableReferencesFailEagerResolution() {
        var documents = Map.<String, Map<String, Object>>of("a.json", doc("x", token("color", "{missing}")));
        var raw = doc("sets", List.of(doc("values", List.of("a.json"))), "options", doc("resolveReferences", true));
        var inMemory = new PermutationResolver(TokenFileReader.inMemory(documents));

        var ex = assertThrows(ManifestException.class, () -> inMemory.resolvePermutation(raw, Map.of()));
        assertTrue(ex.getMessage().startsWith("Reference resolution failed:"));
        assertTrue(ex.problems().get(0).contains("{missing}"));
    }

    @Test
    void withoutEagerResolutionTokensAreMergedOnly() throws IOException {
        var documents = Map.<String, Map<String, Object>>of("a.json", doc("x", token("color", "{missing}")));
        var raw = doc("sets", List.of(doc("values", List.of("a.json"))));
        var permutation = new PermutationResolver(TokenFileReader.inMemory(documents)).resolvePermutation(raw, Map.of());
        assertTrue(permutation.resolvedTokens().isEmpty());
        assertEquals(doc("x", token("color", "{missing}")), permutation.tokens());
    }

    @Test
    void readerFailuresPropagate() {
        var raw = doc("sets", List.of(doc("values", List.of("absent.json"))));
        var inMemory = new PermutationResolver(TokenFileReader.inMemory(Map.of()));
        assertThrows(NoSuchFileException.class, () -> inMemory.resolvePermutation(raw, Map.of()));
    }

    @Test
    void generateAllWithoutSpecsCoversTheWholeSpace() throws IOException {
        var permutations = resolver.generateAll(manifest);
        assertEquals(2 * 8, permutations.size());
        assertEquals("theme-light", permutations.get(0).id());
        assertEquals(16, permutations.stream().map(Permutation::id).distinct().count());
    }

    @Test
    void generateSpecsExpandWithOutputNames() throws IOException {
        var yamlManifest = ManifestParser.parse(reader.read("manifest-generate.yaml"));
        var permutations = resolver.generateAll(yamlManifest);
        assertEquals(List.of("theme-light", "theme-dark"), permutations.stream().map(Permutation::id).toList());
        assertEquals(Optional.of("dist/tokens-light.json"), permutations.get(0).output());
        assertEquals(Optional.of("dist/tokens-dark.json"), permutations.get(1).output());
    }

    @Test
    void filteredCollectionHonoursIncludeAndExclude() {
        var raw = doc(
            "sets", List.of(doc("name", "core", "values", List.of("core.json")), doc("name", "extra", "values", List.of("extra.json"))),
            "modifiers", doc(
                "theme", doc("oneOf", List.of("light", "dark"), "values", doc("light", List.of("light.json"), "dark", List.of("dark.json"))),
                "density", doc("oneOf", List.of("compact"), "values", doc("compact", List.of("compact.json")))
            ),
            "generate", List.of(doc("theme", "light", "density", "compact", "excludeSets", List.of("extra"), "excludeModifiers", List.of("density:compact")))
        );
        var parsed = ManifestParser.parse(raw);
        var spec = parsed.generate().get(0);
        var files = resolver.collectFiles(parsed, doc("theme", "light", "density", "compact"), spec);
        assertEquals(List.of("core.json", "light.json"), files);
    }

    @Test
    void excludingANamedSetKeepsUnnamedSets() {
        var raw = doc(
            "sets", List.of(doc("values", List.of("base.json")), doc("name", "extra", "values", List.of("extra.json"))),
            "modifiers", doc("theme", doc("oneOf", List.of("light"), "values", doc("light", List.of("light.json")))),
            "generate", List.of(
                doc("theme", "light", "excludeSets", List.of("extra")),
                doc("theme", "light", "includeSets", List.of("extra")),
                doc("theme", "light", "excludeSets", List.of("*"))
            )
        );
        var parsed = ManifestParser.parse(raw);
        var input = doc("theme", "light");

        assertEquals(List.of("base.json", "light.json"), resolver.collectFiles(parsed, input, parsed.generate().get(0)));
        assertEquals(List.of("extra.json", "light.json"), resolver.collectFiles(parsed, input, parsed.generate().get(1)));
        assertEquals(List.of("light.json"), resolver.collectFiles(parsed, input, parsed.generate().get(2)));
    }

    @Test
    void includeModifiersPrunesSelectedModifiersItDoesNotName() throws IOException {
        var entry = doc("theme", "light", "colors", List.of("red"), "includeModifiers", List.of("theme"));
        var parsed = ManifestParser.parse(withGenerate(entry));

        var files = resolver.collectFiles(parsed, doc("theme", "light", "colors", List.of("red")), parsed.generate().get(0));

        assertEquals(List.of("tokens/base.json", "tokens/light.json"), files);
    }

    @Test
    void modifierFiltersCompareTheNameBeforeTheColon() throws IOException {
        var entry = doc("theme", "light", "colors", List.of("red"), "includeModifiers", List.of("theme:dark", "colors:blue"), "excludeModifiers", List.of("colors:green"));
        var parsed = ManifestParser.parse(withGenerate(entry));

        var files = resolver.collectFiles(parsed, doc("theme", "light", "colors", List.of("red")), parsed.generate().get(0));

        assertEquals(List.of("tokens/base.json", "tokens/light.json"), files);
    }

    @Test
    void wildcardFilesFollowEverySelectedOptionOnce() {
        var raw = doc(
            "sets", List.of(doc("values", List.of("base.json"))),
            "modifiers", doc(
                "theme", doc("oneOf", List.of("light", "dark"), "values",
                    doc("light", List.of("light.json"), "dark", List.of("dark.json"), "*", List.of("theme-common.json"))),
                "colors", doc("anyOf", List.of("red", "blue"), "values",
                    doc("red", List.of("red.json"), "blue", List.of("blue.json", "base.json"), "*", List.of("palette.json")))
            )
        );
        var parsed = ManifestParser.parse(raw);

        assertEquals(List.of("base.json"), resolver.collectFiles(parsed, Map.of()));
        assertEquals(List.of("base.json", "dark.json", "theme-common.json"), resolver.collectFiles(parsed, doc("theme", "dark")));
        assertEquals(
            List.of("base.json", "light.json", "theme-common.json", "red.json", "palette.json", "blue.json"),
            resolver.collectFiles(parsed, doc("theme", "light", "colors", List.of("red", "blue")))
        );
    }

    private Map<String, Object> withGenerate(Map<String, Object> entry) throws IOException {
        var raw = new LinkedHashMap<>(reader.read("manifest.json"));
        raw.put("generate", List.of(entry));
        return raw;
    }
}
