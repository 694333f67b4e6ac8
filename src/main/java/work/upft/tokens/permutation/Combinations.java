package work.upft.tokens.permutation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.upft.tokens.manifest.Manifest;
import work.upft.tokens.manifest.Modifier;

/**
 * Cartesian products and power sets over modifier options.
 */
public final class Combinations {
    private Combinations() {}

    /**
     * Every assignment of one value per axis; the first axis varies slowest.
     */
    public static List<Map<String, Object>> cartesian(Map<String, List<Object>> axes) {
        List<Map<String, Object>> result = new ArrayList<>();
        result.add(new LinkedHashMap<>());
        for (var axis : axes.entrySet()) {
            var next = new ArrayList<Map<String, Object>>();
            for (Map<String, Object> partial : result) {
                for (Object value : axis.getValue()) {
                    var combination = new LinkedHashMap<>(partial);
                    combination.put(axis.getKey(), value);
                    next.add(combination);
                }
            }
            result = next;
        }
        return result;
    }

    /**
     * All subsets in binary counting order, starting with the empty set.
     */
    public static List<List<String>> powerSet(List<String> options) {
        if (options.size() > 20) {
            throw new IllegalArgumentException("Too many options for a power set: " + options.size());
        }
        var subsets = new ArrayList<List<String>>();
        int count = 1 << options.size();
        for (int mask = 0; mask < count; mask++) {
            var subset = new ArrayList<String>();
            for (int i = 0; i < options.size(); i++) {
                if ((mask & (1 << i)) != 0) {
                    subset.add(options.get(i));
                }
            }
            subsets.add(List.copyOf(subset));
        }
        return subsets;
    }

    /**
     * Inputs for the whole permutation space: every oneOf option crossed with every anyOf subset.
     */
    public static List<Map<String, Object>> fullSpace(Manifest manifest) {
        var axes = new LinkedHashMap<String, List<Object>>();
        for (Modifier modifier : manifest.modifiers().values()) {
            if (modifier.isOneOf()) {
                axes.put(modifier.name(), new ArrayList<>(modifier.options()));
            } else {
                axes.put(modifier.name(), new ArrayList<>(powerSet(modifier.options())));
            }
        }
        return cartesian(axes);
    }
}
