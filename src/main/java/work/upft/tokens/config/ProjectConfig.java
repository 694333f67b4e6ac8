package work.upft.tokens.config;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Settings read from {@code upft.toml}. Absent keys leave the caller's defaults in place.
 */
public record ProjectConfig(Optional<String> basePath, Optional<Boolean> resolveReferences, OptionalInt maxDepth) {
    public static final ProjectConfig EMPTY = new ProjectConfig(Optional.empty(), Optional.empty(), OptionalInt.empty());
}
