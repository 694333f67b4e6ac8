package work.upft.tokens.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.upft.tokens.ast.AstBuilder;
import work.upft.tokens.ast.TokenNode;
import work.upft.tokens.graph.AstQuery;

/**
 * Token-level differences between two documents. Values are compared as written.
 */
public final class TokenComparison {
    private TokenComparison() {}

    public record Result(List<String> added, List<String> removed, List<String> changed) {
        public boolean identical() {
            return added.isEmpty() && removed.isEmpty() && changed.isEmpty();
        }
    }

    public record Detailed(List<TokenDifference> differences, Result summary) {}

    public static Result compare(Map<String, Object> left, Map<String, Object> right) {
        return compareDetailed(left, right).summary();
    }

    public static Detailed compareDetailed(Map<String, Object> left, Map<String, Object> right) {
        var leftTokens = index(left);
        var rightTokens = index(right);
        var differences = new ArrayList<TokenDifference>();
        var added = new ArrayList<String>();
        var removed = new ArrayList<String>();
        var changed = new ArrayList<String>();

        leftTokens.forEach((path, token) -> {
            var other = rightTokens.get(path);
            var leftValue = token.typedValue().value();
            if (other == null) {
                removed.add(path);
                differences.add(new TokenDifference(path, TokenDifference.Kind.REMOVED, leftValue, null));
            } else if (!Objects.equals(leftValue, other.typedValue().value())) {
                changed.add(path);
                differences.add(new TokenDifference(path, TokenDifference.Kind.CHANGED, leftValue, other.typedValue().value()));
            }
        });
        rightTokens.forEach((path, token) -> {
            if (!leftTokens.containsKey(path)) {
                added.add(path);
                differences.add(new TokenDifference(path, TokenDifference.Kind.ADDED, null, token.typedValue().value()));
            }
        });
        return new Detailed(List.copyOf(differences), new Result(List.copyOf(added), List.copyOf(removed), List.copyOf(changed)));
    }

    private static Map<String, TokenNode> index(Map<String, Object> document) {
        var tokens = new LinkedHashMap<String, TokenNode>();
        for (TokenNode token : AstQuery.findAllTokens(AstBuilder.build(document))) {
            tokens.put(token.path(), token);
        }
        return tokens;
    }
}
