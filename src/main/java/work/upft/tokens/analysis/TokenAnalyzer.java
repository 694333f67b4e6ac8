package work.upft.tokens.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.upft.tokens.ast.AstBuilder;
import work.upft.tokens.ast.TokenNode;
import work.upft.tokens.graph.AstQuery;
import work.upft.tokens.graph.AstStatistics;
import work.upft.tokens.graph.CycleDetector;
import work.upft.tokens.model.TokenType;
import work.upft.tokens.model.TypedValue;
import work.upft.tokens.resolve.ReferenceResolver;
import work.upft.tokens.resolve.ResolutionError;

/**
 * Summaries of a single token document.
 */
public final class TokenAnalyzer {
    private TokenAnalyzer() {}

    public static TokenAnalysis analyze(Map<String, Object> document) {
        var root = AstBuilder.build(document);
        var stats = AstStatistics.of(root);
        var cycles = CycleDetector.detectCycles(root);
        var result = new ReferenceResolver().resolve(root);
        var unresolved = result.errorsOfKind(ResolutionError.Kind.MISSING).stream().map(ResolutionError::path).toList();
        var circular = new ArrayList<>(cycles.cyclicTokens());
        circular.sort(null);
        return new TokenAnalysis(
            stats.totalTokens(),
            Math.max(0, stats.totalGroups() - 1),
            stats.tokensByType(),
            stats.maxDepth(),
            stats.referenceCount(),
            stats.tokensWithReferences(),
            unresolved,
            List.copyOf(circular)
        );
    }

    /**
     * Lists tokens, optionally narrowed to one type or to the tokens under one group path.
     *
     * @param type wire name of a token type, or {@code null}
     * @param group group path, or {@code null}
     */
    public static List<TokenListItem> listTokens(Map<String, Object> document, String type, String group, boolean resolve) {
        var root = AstBuilder.build(document);
        List<TokenNode> tokens;
        if (type != null) {
            tokens = TokenType.fromName(type).map(t -> AstQuery.findTokensByType(root, t)).orElse(List.of());
        } else if (group != null) {
            tokens = AstQuery.findAllTokens(root).stream().filter(t -> t.path().startsWith(group + ".")).toList();
        } else {
            tokens = AstQuery.findAllTokens(root);
        }
        if (resolve) {
            new ReferenceResolver().resolve(root);
        }
        var items = new ArrayList<TokenListItem>(tokens.size());
        for (TokenNode token : tokens) {
            Optional<Object> resolved = resolve ? token.resolvedValue().map(TypedValue::value) : Optional.empty();
            items.add(new TokenListItem(token.path(), token.type().wireName(), token.typedValue().value(), resolved, token.hasReferences()));
        }
        return items;
    }
}
