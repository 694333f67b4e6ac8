package work.upft.tokens.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import work.upft.tokens.manifest.ManifestException;
import work.upft.tokens.permutation.Permutation;

/**
 * Outcome of a {@link ManifestRunner} call: the permutations produced, or the failure that stopped
 * the run.
 */
public record RunResult(
    Status status,
    String manifest,
    Optional<String> name,
    List<Permutation> permutations,
    Optional<Exception> failure,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        permutations = List.copyOf(permutations);
    }

    public static RunResult success(String manifest, Optional<String> name, List<Permutation> permutations, Instant startedAt) {
        return new RunResult(Status.SUCCESS, manifest, name, permutations, Optional.empty(), startedAt, Instant.now());
    }

    public static RunResult failure(String manifest, Exception failure, Instant startedAt) {
        return new RunResult(Status.FAILURE, manifest, Optional.empty(), List.of(), Optional.of(failure), startedAt, Instant.now());
    }

    public int count() {
        return permutations.size();
    }

    public List<String> permutationIds() {
        return permutations.stream().map(Permutation::id).toList();
    }

    /**
     * Headline of the failure; a {@link ManifestException} keeps its problems in {@link #problems()}.
     */
    public Optional<String> error() {
        return failure.map(ex -> {
            if (ex instanceof ManifestException manifestFailure) {
                return manifestFailure.headline();
            }
            var message = ex.getMessage();
            return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
        });
    }

    public List<String> problems() {
        return failure.filter(ManifestException.class::isInstance)
            .map(ex -> ((ManifestException) ex).problems())
            .orElse(List.of());
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("manifest", manifest);
        name.ifPresent(value -> serializable.put("name", value));
        if (status == Status.SUCCESS) {
            serializable.put("count", count());
            serializable.put("ids", permutationIds());
            serializable.put("permutations", permutations.stream().map(Permutation::toSerializableMap).toList());
        }
        error().ifPresent(message -> serializable.put("error", message));
        if (!problems().isEmpty()) {
            serializable.put("problems", problems());
        }
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getOriginalMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
