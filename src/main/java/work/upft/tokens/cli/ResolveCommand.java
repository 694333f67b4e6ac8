package work.upft.tokens.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.upft.tokens.api.LogLevel;
import work.upft.tokens.api.ManifestRunner;
import work.upft.tokens.api.RunConfiguration;
import work.upft.tokens.api.RunResult;
import work.upft.tokens.config.ProjectConfig;
import work.upft.tokens.config.ProjectConfigLoader;
import work.upft.tokens.resolve.ReferenceResolver;

@CommandLine.Command(
    name = "upft-resolve",
    description = "Resolve design token permutations described by a manifest.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ResolveCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();

    @CommandLine.Option(
        names = {"-m", "--manifest"},
        required = true,
        description = "Manifest file (JSON or YAML)."
    )
    private Path manifest;

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "JSON|PATH|-",
        description = "Modifier input as inline JSON, a JSON file, or '-' for stdin (default: {}).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String input;

    @CommandLine.Option(
        names = {"-a", "--all"},
        description = "Generate every permutation instead of a single one."
    )
    private boolean all;

    @CommandLine.Option(
        names = "--resolve-references",
        negatable = true,
        description = "Override the manifest's resolveReferences option.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Boolean resolveReferences;

    @CommandLine.Option(
        names = "--base-path",
        description = "Directory token file paths are relative to (default: manifest directory).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path basePath;

    @CommandLine.Option(
        names = "--config",
        description = "Project configuration file (default: upft.toml next to the manifest).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--max-depth",
        description = "Maximum alias chain length before resolution gives up.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer maxDepth;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() throws Exception {
        var manifestPath = manifest.toAbsolutePath().normalize();
        if (!Files.isRegularFile(manifestPath)) {
            throw new CommandLine.ParameterException(new CommandLine(this), "Manifest file not found: " + manifestPath);
        }
        Optional<LogLevel> logLevel = resolveLogLevel();

        ProjectConfig projectConfig = loadProjectConfig(manifestPath);
        var builder = RunConfiguration.builder()
            .manifestPath(manifestPath)
            .inputPayload(loadInputPayload())
            .generateAll(all)
            .logLevel(logLevel);

        if (basePath != null) {
            builder.basePath(basePath.toAbsolutePath().normalize());
        } else if (projectConfig.basePath().isPresent()) {
            builder.basePath(manifestPath.getParent().resolve(projectConfig.basePath().get()).normalize());
        }
        if (resolveReferences != null) {
            builder.resolveReferences(Optional.of(resolveReferences));
        } else {
            builder.resolveReferences(projectConfig.resolveReferences());
        }
        if (maxDepth != null) {
            builder.maxDepth(maxDepth);
        } else {
            builder.maxDepth(projectConfig.maxDepth().orElse(ReferenceResolver.DEFAULT_MAX_DEPTH));
        }

        RunResult result = new ManifestRunner().run(builder.build());
        System.out.println(result.toPrettyJson());
        if (result.failure().isPresent()) {
            throw result.failure().get();
        }
        return result.status().exitCode();
    }

    private Optional<LogLevel> resolveLogLevel() {
        try {
            return LogLevel.parse(logLevelRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(new CommandLine(this), ex.getMessage());
        }
    }

    private ProjectConfig loadProjectConfig(Path manifestPath) throws IOException {
        if (config != null) {
            var path = config.toAbsolutePath().normalize();
            return ProjectConfigLoader.load(path)
                .orElseThrow(() -> new CommandLine.ParameterException(new CommandLine(this), "Config file not found: " + path));
        }
        return ProjectConfigLoader.loadNextTo(manifestPath).orElse(ProjectConfig.EMPTY);
    }

    private String loadInputPayload() {
        if (input == null || input.isBlank()) {
            return "{}";
        }
        if ("-".equals(input)) {
            String payload = readStdin();
            validateJsonPayload(payload);
            return payload;
        }
        String trimmed = input.trim();
        if (trimmed.startsWith("{")) {
            validateJsonPayload(trimmed);
            return trimmed;
        }
        Path path = Paths.get(input).toAbsolutePath().normalize();
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            validateJsonPayload(content);
            return content;
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(new CommandLine(this), "Cannot read input file: " + path);
        }
    }

    private void validateJsonPayload(String payload) {
        String trimmed = payload.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        try {
            var node = JSON.readTree(trimmed);
            if (node != null && !node.isObject()) {
                throw new CommandLine.ParameterException(new CommandLine(this), "JSON payload must be an object");
            }
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(new CommandLine(this), "Invalid JSON payload: " + ex.getMessage());
        }
    }

    private String readStdin() {
        try {
            InputStream stdin = System.in;
            byte[] bytes = stdin.readAllBytes();
            if (bytes.length == 0) {
                return "{}";
            }
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(new CommandLine(this), "Unable to read stdin: " + ex.getMessage(), ex);
        }
    }
}
