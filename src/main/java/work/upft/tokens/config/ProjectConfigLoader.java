package work.upft.tokens.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads the {@code [resolver]} table of an {@code upft.toml} file.
 */
public final class ProjectConfigLoader {
    public static final String FILE_NAME = "upft.toml";

    private ProjectConfigLoader() {}

    public static Optional<ProjectConfig> load(Path configPath) throws IOException {
        if (configPath == null || !Files.isRegularFile(configPath)) {
            return Optional.empty();
        }
        TomlParseResult result = Toml.parse(Files.readString(configPath));
        if (result.hasErrors()) {
            var details = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IOException("Invalid " + configPath + ": " + details);
        }
        return Optional.of(fromToml(result));
    }

    /**
     * Looks for {@code upft.toml} next to the manifest.
     */
    public static Optional<ProjectConfig> loadNextTo(Path manifestPath) throws IOException {
        var parent = manifestPath.toAbsolutePath().getParent();
        return parent == null ? Optional.empty() : load(parent.resolve(FILE_NAME));
    }

    public static ProjectConfig fromToml(TomlParseResult result) {
        TomlTable resolver = result.getTable("resolver");
        if (resolver == null || resolver.isEmpty()) {
            return ProjectConfig.EMPTY;
        }
        var basePath = Optional.ofNullable(resolver.getString("basePath"));
        var resolve = Optional.ofNullable(resolver.getBoolean("resolveReferences"));
        Long depth = resolver.getLong("maxDepth");
        return new ProjectConfig(basePath, resolve, depth == null ? OptionalInt.empty() : OptionalInt.of(Math.toIntExact(depth)));
    }
}
