package work.upft.tokens.manifest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One entry of the manifest's {@code generate} list. Selection values are a string, a list of
 * strings or {@code "*"}.
 */
public record GenerateSpec(
    Map<String, Object> selections,
    Optional<String> output,
    Optional<List<String>> includeSets,
    Optional<List<String>> excludeSets,
    Optional<List<String>> includeModifiers,
    Optional<List<String>> excludeModifiers
) {
    public GenerateSpec {
        selections = Collections.unmodifiableMap(new LinkedHashMap<>(selections));
    }
}
