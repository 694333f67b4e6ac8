package work.upft.tokens.manifest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed manifest. Modifiers keep their declaration order.
 */
public record Manifest(
    Optional<String> name,
    Optional<String> description,
    List<TokenSet> sets,
    Map<String, Modifier> modifiers,
    List<GenerateSpec> generate,
    ManifestOptions options
) {
    public Manifest {
        sets = List.copyOf(sets);
        modifiers = Collections.unmodifiableMap(new LinkedHashMap<>(modifiers));
        generate = List.copyOf(generate);
        options = options == null ? ManifestOptions.DEFAULT : options;
    }

    public Optional<Modifier> modifier(String name) {
        return Optional.ofNullable(modifiers.get(name));
    }

    public boolean hasGenerateSpecs() {
        return !generate.isEmpty();
    }

    public Manifest withOptions(ManifestOptions newOptions) {
        return new Manifest(name, description, sets, modifiers, generate, newOptions);
    }
}
