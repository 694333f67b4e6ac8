package work.upft.tokens.permutation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import work.upft.tokens.manifest.GenerateSpec;
import work.upft.tokens.manifest.Manifest;
import work.upft.tokens.manifest.Modifier;

/**
 * Expansion and filtering rules for {@code generate} entries.
 */
public final class GenerateSpecs {
    private GenerateSpecs() {}

    public record Expansion(Map<String, Object> input, Optional<String> output) {}

    /**
     * Expands one entry into concrete inputs. A oneOf given as {@code "*"} or as a list, and a oneOf
     * named in {@code includeModifiers} without a value, become axes of the cross product; anyOf
     * selections stay fixed ({@code "*"} meaning every option).
     */
    public static List<Expansion> expand(Manifest manifest, GenerateSpec spec) {
        var fixed = new LinkedHashMap<String, Object>();
        var axes = new LinkedHashMap<String, List<Object>>();
        spec.selections().forEach((name, value) -> {
            var modifier = manifest.modifier(name);
            if (modifier.isEmpty()) {
                fixed.put(name, value);
            } else if (modifier.get().isOneOf()) {
                if (Modifier.WILDCARD.equals(value)) {
                    axes.put(name, new ArrayList<>(modifier.get().options()));
                } else if (value instanceof List<?> list) {
                    axes.put(name, new ArrayList<>(list));
                } else {
                    fixed.put(name, value);
                }
            } else {
                fixed.put(name, Modifier.WILDCARD.equals(value) ? modifier.get().options() : value);
            }
        });
        spec.includeModifiers().ifPresent(entries -> applyIncludes(manifest, entries, fixed, axes));

        var expansions = new ArrayList<Expansion>();
        for (Map<String, Object> combination : Combinations.cartesian(axes)) {
            var input = new LinkedHashMap<>(fixed);
            input.putAll(combination);
            var output = spec.output().map(base -> outputName(base, combination));
            expansions.add(new Expansion(input, output));
        }
        return expansions;
    }

    private static void applyIncludes(Manifest manifest, List<String> entries, Map<String, Object> fixed, Map<String, List<Object>> axes) {
        for (String entry : entries) {
            int colon = entry.indexOf(':');
            var name = colon < 0 ? entry : entry.substring(0, colon);
            var modifier = manifest.modifier(name);
            if (modifier.isEmpty() || fixed.containsKey(name) && colon < 0 || axes.containsKey(name)) {
                continue;
            }
            if (colon >= 0) {
                var value = entry.substring(colon + 1);
                if (modifier.get().isOneOf()) {
                    fixed.put(name, value);
                } else {
                    var selected = new ArrayList<Object>();
                    if (fixed.get(name) instanceof List<?> existing) {
                        selected.addAll(existing);
                    }
                    if (!selected.contains(value)) {
                        selected.add(value);
                    }
                    fixed.put(name, selected);
                }
            } else if (modifier.get().isOneOf()) {
                axes.put(name, new ArrayList<>(modifier.get().options()));
            }
        }
    }

    /**
     * {@code <base without extension>[-<values>].json}; anyOf values are joined with {@code +}.
     */
    static String outputName(String base, Map<String, Object> combination) {
        int slash = base.lastIndexOf('/');
        int dot = base.lastIndexOf('.');
        var stem = dot > slash ? base.substring(0, dot) : base;
        if (combination.isEmpty()) {
            return stem + ".json";
        }
        var suffix = combination.values().stream()
            .map(value -> value instanceof List<?> list
                ? list.stream().map(String::valueOf).collect(Collectors.joining("+"))
                : String.valueOf(value))
            .collect(Collectors.joining("-"));
        return stem + "-" + suffix + ".json";
    }

    /**
     * Unnamed sets cannot be named by a filter; they drop out only under {@code includeSets} or an
     * {@code excludeSets} wildcard.
     */
    public static boolean includesSet(GenerateSpec spec, Optional<String> setName) {
        var excluded = spec.excludeSets().orElse(List.of());
        if (excluded.contains(Modifier.WILDCARD)) {
            return false;
        }
        if (setName.isEmpty()) {
            return spec.includeSets().isEmpty();
        }
        var name = setName.get();
        if (excluded.contains(name)) {
            return false;
        }
        return spec.includeSets().map(list -> list.contains(name) || list.contains(Modifier.WILDCARD)).orElse(true);
    }

    /**
     * Filter entries are {@code name} or {@code name:value}; only the name part is compared. Exclusion
     * wins, and an include list that does not name the modifier drops it.
     */
    public static boolean includesModifier(GenerateSpec spec, String modifier) {
        if (spec.excludeModifiers().map(list -> namesModifier(list, modifier)).orElse(false)) {
            return false;
        }
        return spec.includeModifiers().map(list -> namesModifier(list, modifier)).orElse(true);
    }

    private static boolean namesModifier(List<String> entries, String modifier) {
        for (String entry : entries) {
            int colon = entry.indexOf(':');
            var name = colon < 0 ? entry : entry.substring(0, colon);
            if (Modifier.WILDCARD.equals(entry) || name.equals(modifier)) {
                return true;
            }
        }
        return false;
    }
}
