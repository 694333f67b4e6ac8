package work.upft.tokens.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.upft.tokens.io.FileSystemTokenReader;
import work.upft.tokens.manifest.ManifestOptions;
import work.upft.tokens.manifest.ManifestParser;
import work.upft.tokens.permutation.Permutation;
import work.upft.tokens.permutation.PermutationResolver;
import work.upft.tokens.resolve.ReferenceResolver;

/**
 * Public entry point for resolving a manifest from disk.
 */
public final class ManifestRunner {
    private static final Logger log = LoggerFactory.getLogger(ManifestRunner.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    public RunResult run(RunConfiguration configuration) {
        var started = Instant.now();
        configuration.logLevel().ifPresent(LogLevel::apply);
        var manifestName = configuration.manifestPath().toString();
        try {
            var reader = new FileSystemTokenReader(configuration.basePath());
            var manifestFile = configuration.manifestPath().toAbsolutePath().normalize();
            var manifest = ManifestParser.parse(reader.read(manifestFile.toUri().toString()));
            if (configuration.resolveReferences().isPresent()) {
                manifest = manifest.withOptions(new ManifestOptions(configuration.resolveReferences().get()));
            }
            var resolver = new PermutationResolver(reader, new ReferenceResolver(configuration.maxDepth()));

            List<Permutation> permutations;
            if (configuration.generateAll()) {
                permutations = resolver.generateAll(manifest);
            } else {
                permutations = List.of(resolver.resolvePermutation(manifest, parseInput(configuration.inputPayload())));
            }
            log.info("Resolved {} permutation(s) from {}", permutations.size(), manifestName);
            return RunResult.success(manifestName, manifest.name(), permutations, started);
        } catch (Exception ex) {
            log.debug("Manifest run failed", ex);
            return RunResult.failure(manifestName, ex, started);
        }
    }

    private Map<String, Object> parseInput(String payload) {
        if (payload == null || payload.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return new LinkedHashMap<>(JSON.readValue(payload, MAP_REF));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid JSON input payload", ex);
        }
    }
}
