package work.upft.tokens.permutation;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.upft.tokens.ast.AstBuilder;
import work.upft.tokens.ast.AstFlattener;
import work.upft.tokens.io.TokenFileReader;
import work.upft.tokens.manifest.GenerateSpec;
import work.upft.tokens.manifest.InputError;
import work.upft.tokens.manifest.Manifest;
import work.upft.tokens.manifest.ManifestException;
import work.upft.tokens.manifest.ManifestParser;
import work.upft.tokens.manifest.ManifestValidator;
import work.upft.tokens.manifest.Modifier;
import work.upft.tokens.manifest.TokenSet;
import work.upft.tokens.resolve.ReferenceResolver;
import work.upft.tokens.resolve.ResolutionError;

/**
 * Turns a manifest and modifier input into merged (and optionally resolved) token documents.
 */
public final class PermutationResolver {
    private static final Logger log = LoggerFactory.getLogger(PermutationResolver.class);

    private final TokenFileReader reader;
    private final ReferenceResolver referenceResolver;

    public PermutationResolver(TokenFileReader reader) {
        this(reader, new ReferenceResolver());
    }

    public PermutationResolver(TokenFileReader reader, ReferenceResolver referenceResolver) {
        this.reader = reader;
        this.referenceResolver = referenceResolver;
    }

    /**
     * Set files, then the files of every selected modifier option in manifest order. Duplicates
     * keep their first position.
     */
    public List<String> collectFiles(Manifest manifest, Map<String, Object> input) {
        var files = new LinkedHashSet<String>();
        for (TokenSet set : manifest.sets()) {
            files.addAll(set.files());
        }
        for (Modifier modifier : manifest.modifiers().values()) {
            for (String option : selectedOptions(modifier, input)) {
                files.addAll(modifier.filesFor(option));
            }
        }
        return List.copyOf(files);
    }

    /**
     * Like {@link #collectFiles(Manifest, Map)}, honouring the set and modifier filters of a
     * {@code generate} entry.
     */
    public List<String> collectFiles(Manifest manifest, Map<String, Object> input, GenerateSpec spec) {
        var files = new LinkedHashSet<String>();
        for (TokenSet set : manifest.sets()) {
            if (GenerateSpecs.includesSet(spec, set.name())) {
                files.addAll(set.files());
            }
        }
        for (Modifier modifier : manifest.modifiers().values()) {
            if (!GenerateSpecs.includesModifier(spec, modifier.name())) {
                continue;
            }
            for (String option : selectedOptions(modifier, input)) {
                files.addAll(modifier.filesFor(option));
            }
        }
        return List.copyOf(files);
    }

    private static List<String> selectedOptions(Modifier modifier, Map<String, Object> input) {
        var value = input == null ? null : input.get(modifier.name());
        var selected = new ArrayList<String>();
        if (modifier.isOneOf() && value instanceof String option && modifier.hasOption(option)) {
            selected.add(option);
        } else if (modifier.isAnyOf() && value instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof String option && modifier.hasOption(option) && !selected.contains(option)) {
                    selected.add(option);
                }
            }
        }
        return selected;
    }

    public Map<String, Object> loadAndMerge(List<String> files) throws IOException {
        var documents = new ArrayList<Map<String, Object>>(files.size());
        for (String file : files) {
            log.debug("Loading token file {}", file);
            documents.add(reader.read(file));
        }
        return DocumentMerger.mergeAll(documents);
    }

    public Permutation resolvePermutation(Map<String, Object> rawManifest, Map<String, Object> input) throws IOException {
        return resolvePermutation(ManifestParser.parse(rawManifest), input);
    }

    public Permutation resolvePermutation(Manifest manifest, Map<String, Object> input) throws IOException {
        return resolvePermutation(manifest, input, null);
    }

    public Permutation resolvePermutation(Manifest manifest, Map<String, Object> input, GenerateSpec spec) throws IOException {
        var safeInput = input == null ? Map.<String, Object>of() : input;
        var validation = ManifestValidator.validateInput(manifest, safeInput);
        if (!validation.valid()) {
            throw new ManifestException("Invalid input", validation.errors().stream().map(InputError::describe).toList());
        }
        var files = spec == null ? collectFiles(manifest, safeInput) : collectFiles(manifest, safeInput, spec);
        var tokens = loadAndMerge(files);
        var id = PermutationIds.of(safeInput);
        log.debug("Permutation {} merged from {} files", id, files.size());

        Optional<Map<String, Object>> resolved = Optional.empty();
        if (manifest.options().resolveReferences()) {
            var root = AstBuilder.build(tokens);
            var result = referenceResolver.resolve(root);
            if (!result.isSuccess()) {
                throw new ManifestException("Reference resolution failed", result.errors().stream().map(ResolutionError::describe).toList());
            }
            resolved = Optional.of(AstFlattener.toDocument(root, true));
        }
        var output = safeInput.get(ManifestValidator.OUTPUT_KEY) instanceof String path ? Optional.of(path) : Optional.<String>empty();
        return new Permutation(id, safeInput, files, tokens, resolved, output);
    }

    public List<Permutation> generateAll(Map<String, Object> rawManifest) throws IOException {
        return generateAll(ManifestParser.parse(rawManifest));
    }

    /**
     * Every permutation the manifest's {@code generate} entries describe, or the full space when it
     * has none. The first failure stops generation.
     */
    public List<Permutation> generateAll(Manifest manifest) throws IOException {
        var permutations = new ArrayList<Permutation>();
        if (manifest.hasGenerateSpecs()) {
            for (GenerateSpec spec : manifest.generate()) {
                for (GenerateSpecs.Expansion expansion : GenerateSpecs.expand(manifest, spec)) {
                    var permutation = resolvePermutation(manifest, expansion.input(), spec);
                    permutations.add(expansion.output().map(permutation::withOutput).orElse(permutation));
                }
            }
        } else {
            for (Map<String, Object> input : Combinations.fullSpace(manifest)) {
                permutations.add(resolvePermutation(manifest, input));
            }
        }
        log.debug("Generated {} permutations", permutations.size());
        return permutations;
    }
}
