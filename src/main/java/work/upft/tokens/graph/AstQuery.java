package work.upft.tokens.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import work.upft.tokens.ast.AstNode;
import work.upft.tokens.ast.GroupNode;
import work.upft.tokens.ast.TokenNode;
import work.upft.tokens.model.TokenReference;
import work.upft.tokens.model.TokenType;

/**
 * Path lookups and token searches over a tree.
 */
public final class AstQuery {
    private AstQuery() {}

    public static Optional<AstNode> findNode(GroupNode root, String path) {
        if (path == null || path.isEmpty()) {
            return Optional.of(root);
        }
        AstNode current = root;
        for (String segment : path.split("\\.", -1)) {
            if (!(current instanceof GroupNode group)) {
                return Optional.empty();
            }
            var child = group.child(segment);
            if (child.isEmpty()) {
                return Optional.empty();
            }
            current = child.get();
        }
        return Optional.of(current);
    }

    public static Optional<TokenNode> getToken(GroupNode root, String path) {
        return findNode(root, path).filter(TokenNode.class::isInstance).map(TokenNode.class::cast);
    }

    public static Optional<GroupNode> getGroup(GroupNode root, String path) {
        return findNode(root, path).filter(GroupNode.class::isInstance).map(GroupNode.class::cast);
    }

    public static Optional<GroupNode> parent(GroupNode root, AstNode node) {
        return node.parentPath().flatMap(path -> getGroup(root, path));
    }

    public static List<TokenNode> findAllTokens(AstNode root) {
        var tokens = new ArrayList<TokenNode>();
        AstTraverser.visitTokens(root, tokens::add);
        return tokens;
    }

    public static List<TokenNode> findTokensByType(AstNode root, TokenType type) {
        return findAllTokens(root).stream().filter(token -> token.type() == type).toList();
    }

    public static List<TokenNode> findTokensWithReferences(AstNode root) {
        return findAllTokens(root).stream().filter(TokenNode::hasReferences).toList();
    }

    public static List<TokenNode> findUnresolvedTokens(AstNode root) {
        return findAllTokens(root).stream().filter(token -> !token.isResolved()).toList();
    }

    /**
     * Paths of every token the given token depends on through local references, nearest first.
     */
    public static List<String> findDependencies(GroupNode root, String tokenPath) {
        var seen = new LinkedHashSet<String>();
        var queue = new ArrayDeque<String>();
        queue.add(tokenPath);
        while (!queue.isEmpty()) {
            var token = getToken(root, queue.poll());
            if (token.isEmpty()) {
                continue;
            }
            for (TokenReference ref : token.get().references()) {
                if (ref.isLocal() && !ref.path().equals(tokenPath) && seen.add(ref.path())) {
                    queue.add(ref.path());
                }
            }
        }
        return List.copyOf(seen);
    }

    /**
     * Tokens that reference the given path directly.
     */
    public static List<TokenNode> findDependents(AstNode root, String tokenPath) {
        return findAllTokens(root).stream()
            .filter(token -> token.references().stream().anyMatch(ref -> ref.isLocal() && ref.path().equals(tokenPath)))
            .toList();
    }

    public static List<String> findAllDependents(AstNode root, String tokenPath) {
        var seen = new LinkedHashSet<String>();
        var queue = new ArrayDeque<String>();
        queue.add(tokenPath);
        while (!queue.isEmpty()) {
            for (TokenNode dependent : findDependents(root, queue.poll())) {
                if (!dependent.path().equals(tokenPath) && seen.add(dependent.path())) {
                    queue.add(dependent.path());
                }
            }
        }
        return List.copyOf(seen);
    }
}
