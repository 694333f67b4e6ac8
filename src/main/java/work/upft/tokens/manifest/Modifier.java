package work.upft.tokens.manifest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An axis of variation. {@code values} maps each option, and optionally {@code *}, to its files.
 */
public record Modifier(String name, Kind kind, List<String> options, Map<String, List<String>> values, Optional<Object> defaultValue, Optional<String> description) {
    public static final String WILDCARD = "*";

    public enum Kind {
        ONE_OF("oneOf"),
        ANY_OF("anyOf");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    public Modifier {
        options = List.copyOf(options);
        var copy = new LinkedHashMap<String, List<String>>();
        values.forEach((key, files) -> copy.put(key, List.copyOf(files)));
        values = Collections.unmodifiableMap(copy);
    }

    public boolean isOneOf() {
        return kind == Kind.ONE_OF;
    }

    public boolean isAnyOf() {
        return kind == Kind.ANY_OF;
    }

    public boolean hasOption(String option) {
        return options.contains(option);
    }

    /**
     * Files for one option followed by the wildcard files.
     */
    public List<String> filesFor(String option) {
        var files = new ArrayList<>(values.getOrDefault(option, List.of()));
        files.addAll(values.getOrDefault(WILDCARD, List.of()));
        return files;
    }
}
