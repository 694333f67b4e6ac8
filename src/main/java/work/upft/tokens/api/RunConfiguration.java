package work.upft.tokens.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import work.upft.tokens.resolve.ReferenceResolver;

/**
 * Immutable configuration for one {@link ManifestRunner} call.
 */
public record RunConfiguration(
    Path manifestPath,
    Path basePath,
    String inputPayload,
    boolean generateAll,
    Optional<Boolean> resolveReferences,
    int maxDepth,
    Optional<LogLevel> logLevel
) {
    public RunConfiguration {
        Objects.requireNonNull(manifestPath, "manifestPath");
        Objects.requireNonNull(basePath, "basePath");
        Objects.requireNonNull(inputPayload, "inputPayload");
        Objects.requireNonNull(resolveReferences, "resolveReferences");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path manifestPath;
        private Path basePath;
        private String inputPayload = "{}";
        private boolean generateAll;
        private Optional<Boolean> resolveReferences = Optional.empty();
        private int maxDepth = ReferenceResolver.DEFAULT_MAX_DEPTH;
        private Optional<LogLevel> logLevel = Optional.empty();

        public Builder manifestPath(Path manifestPath) {
            this.manifestPath = manifestPath;
            return this;
        }

        /**
         * Directory manifest file paths are relative to; defaults to the manifest's directory.
         */
        public Builder basePath(Path basePath) {
            this.basePath = basePath;
            return this;
        }

        public Builder inputPayload(String inputPayload) {
            this.inputPayload = inputPayload;
            return this;
        }

        public Builder generateAll(boolean generateAll) {
            this.generateAll = generateAll;
            return this;
        }

        public Builder resolveReferences(Optional<Boolean> resolveReferences) {
            this.resolveReferences = resolveReferences;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        /**
         * Root log threshold applied when the run starts; empty leaves logging as configured.
         */
        public Builder logLevel(Optional<LogLevel> logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public RunConfiguration build() {
            var base = basePath;
            if (base == null && manifestPath != null) {
                var parent = manifestPath.toAbsolutePath().getParent();
                base = parent == null ? Path.of(".") : parent;
            }
            return new RunConfiguration(
                manifestPath,
                base,
                inputPayload,
                generateAll,
                resolveReferences,
                maxDepth,
                logLevel
            );
        }
    }
}
