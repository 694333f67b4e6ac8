package work.upft.tokens.permutation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.upft.tokens.io.JsonValues;

/**
 * One resolved combination of modifier selections. Token documents are frozen copies.
 */
public record Permutation(
    String id,
    Map<String, Object> input,
    List<String> files,
    Map<String, Object> tokens,
    Optional<Map<String, Object>> resolvedTokens,
    Optional<String> output
) {
    public Permutation {
        input = JsonValues.frozenObject(input);
        files = List.copyOf(files);
        tokens = JsonValues.frozenObject(tokens);
        resolvedTokens = resolvedTokens.map(JsonValues::frozenObject);
    }

    public Permutation withOutput(String newOutput) {
        return new Permutation(id, input, files, tokens, resolvedTokens, Optional.ofNullable(newOutput));
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("id", id);
        map.put("input", input);
        map.put("files", files);
        map.put("tokens", tokens);
        resolvedTokens.ifPresent(resolved -> map.put("resolvedTokens", resolved));
        output.ifPresent(path -> map.put("output", path));
        return map;
    }
}
