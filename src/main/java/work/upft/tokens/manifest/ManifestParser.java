package work.upft.tokens.manifest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.upft.tokens.io.JsonValues;

/**
 * Turns a raw manifest document into a {@link Manifest}. Every shape problem is collected before
 * failing.
 */
public final class ManifestParser {
    private ManifestParser() {}

    public static Manifest parse(Map<String, Object> raw) {
        var problems = new ArrayList<String>();
        if (raw == null) {
            throw new ManifestException("Invalid manifest", List.of("manifest must be an object"));
        }
        var sets = parseSets(raw.get("sets"), problems);
        var modifiers = parseModifiers(raw.get("modifiers"), problems);
        var generate = parseGenerate(raw.get("generate"), problems);
        var options = parseOptions(raw.get("options"), problems);
        if (!problems.isEmpty()) {
            throw new ManifestException("Invalid manifest", problems);
        }
        return new Manifest(optionalString(raw.get("name")), optionalString(raw.get("description")), sets, modifiers, generate, options);
    }

    private static List<TokenSet> parseSets(Object raw, List<String> problems) {
        var sets = new ArrayList<TokenSet>();
        if (!(raw instanceof List<?> list) || list.isEmpty()) {
            problems.add("sets: must be a non-empty array");
            return sets;
        }
        for (int i = 0; i < list.size(); i++) {
            var where = "sets[" + i + "]";
            var set = JsonValues.asObject(list.get(i));
            if (set == null) {
                problems.add(where + ": must be an object");
                continue;
            }
            var files = set.containsKey("values") ? set.get("values") : set.get("files");
            var fileList = stringList(files, where + ".values", problems);
            if (fileList.isPresent()) {
                sets.add(new TokenSet(optionalString(set.get("name")), fileList.get(), optionalString(set.get("description"))));
            }
        }
        return sets;
    }

    private static Map<String, Modifier> parseModifiers(Object raw, List<String> problems) {
        var modifiers = new LinkedHashMap<String, Modifier>();
        if (raw == null) {
            return modifiers;
        }
        var map = JsonValues.asObject(raw);
        if (map == null) {
            problems.add("modifiers: must be an object");
            return modifiers;
        }
        map.forEach((name, value) -> parseModifier(name, value, problems).ifPresent(m -> modifiers.put(name, m)));
        return modifiers;
    }

    private static Optional<Modifier> parseModifier(String name, Object raw, List<String> problems) {
        var where = "modifiers." + name;
        var def = JsonValues.asObject(raw);
        if (def == null) {
            problems.add(where + ": must be an object");
            return Optional.empty();
        }
        boolean hasOneOf = def.containsKey("oneOf");
        boolean hasAnyOf = def.containsKey("anyOf");
        if (hasOneOf == hasAnyOf) {
            problems.add(where + ": must declare exactly one of oneOf or anyOf");
            return Optional.empty();
        }
        var kind = hasOneOf ? Modifier.Kind.ONE_OF : Modifier.Kind.ANY_OF;
        var options = stringList(def.get(kind.wireName()), where + "." + kind.wireName(), problems);
        if (options.isEmpty()) {
            return Optional.empty();
        }
        if (options.get().isEmpty()) {
            problems.add(where + "." + kind.wireName() + ": must list at least one option");
            return Optional.empty();
        }
        var valuesRaw = JsonValues.asObject(def.get("values"));
        if (valuesRaw == null) {
            problems.add(where + ".values: must map options to file lists");
            return Optional.empty();
        }
        var values = new LinkedHashMap<String, List<String>>();
        valuesRaw.forEach((option, files) -> {
            if (!Modifier.WILDCARD.equals(option) && !options.get().contains(option)) {
                problems.add(where + ".values." + option + ": is not one of the declared options");
            }
            stringList(files, where + ".values." + option, problems).ifPresent(list -> values.put(option, list));
        });
        var defaultValue = Optional.ofNullable(def.get("default"));
        defaultValue.ifPresent(value -> checkDefault(where, kind, options.get(), value, problems));
        return Optional.of(new Modifier(name, kind, options.get(), values, defaultValue, optionalString(def.get("description"))));
    }

    private static void checkDefault(String where, Modifier.Kind kind, List<String> options, Object value, List<String> problems) {
        var selected = new ArrayList<Object>();
        if (value instanceof List<?> list && kind == Modifier.Kind.ANY_OF) {
            selected.addAll(list);
        } else {
            selected.add(value);
        }
        for (Object item : selected) {
            if (!options.contains(item)) {
                problems.add(where + ".default: '" + item + "' is not one of the declared options");
            }
        }
    }

    private static List<GenerateSpec> parseGenerate(Object raw, List<String> problems) {
        var specs = new ArrayList<GenerateSpec>();
        if (raw == null) {
            return specs;
        }
        if (!(raw instanceof List<?> list)) {
            problems.add("generate: must be an array");
            return specs;
        }
        for (int i = 0; i < list.size(); i++) {
            var where = "generate[" + i + "]";
            var entry = JsonValues.asObject(list.get(i));
            if (entry == null) {
                problems.add(where + ": must be an object");
                continue;
            }
            var selections = new LinkedHashMap<String, Object>();
            Optional<String> output = Optional.empty();
            Optional<List<String>> includeSets = Optional.empty();
            Optional<List<String>> excludeSets = Optional.empty();
            Optional<List<String>> includeModifiers = Optional.empty();
            Optional<List<String>> excludeModifiers = Optional.empty();
            for (var field : entry.entrySet()) {
                var key = field.getKey();
                var value = field.getValue();
                switch (key) {
                    case "output" -> {
                        if (value instanceof String text) {
                            output = Optional.of(text);
                        } else {
                            problems.add(where + ".output: must be a string");
                        }
                    }
                    case "includeSets" -> includeSets = stringList(value, where + "." + key, problems);
                    case "excludeSets" -> excludeSets = stringList(value, where + "." + key, problems);
                    case "includeModifiers" -> includeModifiers = stringList(value, where + "." + key, problems);
                    case "excludeModifiers" -> excludeModifiers = stringList(value, where + "." + key, problems);
                    default -> {
                        if (value instanceof String || value instanceof List<?>) {
                            selections.put(key, JsonValues.deepCopy(value));
                        } else {
                            problems.add(where + "." + key + ": must be a string or an array of strings");
                        }
                    }
                }
            }
            specs.add(new GenerateSpec(selections, output, includeSets, excludeSets, includeModifiers, excludeModifiers));
        }
        return specs;
    }

    private static ManifestOptions parseOptions(Object raw, List<String> problems) {
        if (raw == null) {
            return ManifestOptions.DEFAULT;
        }
        var map = JsonValues.asObject(raw);
        if (map == null) {
            problems.add("options: must be an object");
            return ManifestOptions.DEFAULT;
        }
        var resolve = map.get("resolveReferences");
        if (resolve != null && !(resolve instanceof Boolean)) {
            problems.add("options.resolveReferences: must be a boolean");
            return ManifestOptions.DEFAULT;
        }
        return new ManifestOptions(Boolean.TRUE.equals(resolve));
    }

    private static Optional<List<String>> stringList(Object raw, String where, List<String> problems) {
        if (!(raw instanceof List<?> list)) {
            problems.add(where + ": must be an array of strings");
            return Optional.empty();
        }
        var result = new ArrayList<String>(list.size());
        for (Object item : list) {
            if (!(item instanceof String text)) {
                problems.add(where + ": must contain only strings");
                return Optional.empty();
            }
            result.add(text);
        }
        return Optional.of(result);
    }

    private static Optional<String> optionalString(Object raw) {
        return raw instanceof String text ? Optional.of(text) : Optional.empty();
    }
}
