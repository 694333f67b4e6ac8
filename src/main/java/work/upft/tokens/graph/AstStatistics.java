package work.upft.tokens.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.upft.tokens.ast.AstNode;
import work.upft.tokens.ast.GroupNode;
import work.upft.tokens.ast.TokenNode;

/**
 * Counts over a tree. The root counts as a group at depth 0.
 */
public record AstStatistics(
    int totalTokens,
    int totalGroups,
    int totalNodes,
    Map<String, Integer> tokensByType,
    int maxDepth,
    int tokensWithReferences,
    int referenceCount,
    int unresolvedTokens
) {
    public static AstStatistics of(AstNode root) {
        var counter = new Counter();
        counter.visit(root, 0);
        return new AstStatistics(
            counter.tokens,
            counter.groups,
            counter.tokens + counter.groups,
            Collections.unmodifiableMap(counter.byType),
            counter.maxDepth,
            counter.withReferences,
            counter.references,
            counter.unresolved
        );
    }

    private static final class Counter {
        int tokens;
        int groups;
        int maxDepth;
        int withReferences;
        int references;
        int unresolved;
        final Map<String, Integer> byType = new LinkedHashMap<>();

        void visit(AstNode node, int depth) {
            maxDepth = Math.max(maxDepth, depth);
            if (node instanceof TokenNode token) {
                tokens++;
                byType.merge(token.type().wireName(), 1, Integer::sum);
                if (token.hasReferences()) {
                    withReferences++;
                    references += token.references().size();
                }
                if (!token.isResolved()) {
                    unresolved++;
                }
            } else if (node instanceof GroupNode group) {
                groups++;
                for (AstNode child : group.children().values()) {
                    visit(child, depth + 1);
                }
            }
        }
    }
}
