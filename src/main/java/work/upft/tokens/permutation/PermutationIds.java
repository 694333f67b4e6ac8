package work.upft.tokens.permutation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import work.upft.tokens.manifest.ManifestValidator;

/**
 * Stable permutation identifiers such as {@code colors-red+blue_theme-dark}.
 */
public final class PermutationIds {
    public static final String DEFAULT_ID = "default";

    private PermutationIds() {}

    public static String of(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return DEFAULT_ID;
        }
        var parts = new ArrayList<String>();
        for (var entry : new TreeMap<>(input).entrySet()) {
            if (ManifestValidator.OUTPUT_KEY.equals(entry.getKey())) {
                continue;
            }
            var value = entry.getValue();
            if (value instanceof List<?> list) {
                if (!list.isEmpty()) {
                    parts.add(entry.getKey() + "-" + list.stream().map(String::valueOf).collect(Collectors.joining("+")));
                }
            } else if (value != null && !String.valueOf(value).isEmpty()) {
                parts.add(entry.getKey() + "-" + value);
            }
        }
        return parts.isEmpty() ? DEFAULT_ID : String.join("_", parts);
    }
}
