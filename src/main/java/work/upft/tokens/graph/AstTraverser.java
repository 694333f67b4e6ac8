package work.upft.tokens.graph;

import java.util.function.Predicate;
import work.upft.tokens.ast.AstNode;
import work.upft.tokens.ast.GroupNode;
import work.upft.tokens.ast.TokenNode;

/**
 * Depth-first walks over a token tree. Visitors return {@code false} to stop the walk.
 */
public final class AstTraverser {
    public enum Order {
        PRE,
        POST
    }

    private AstTraverser() {}

    public static boolean traverse(AstNode node, Predicate<AstNode> visitor) {
        return traverse(node, visitor, Order.PRE);
    }

    /**
     * @return {@code false} when a visitor stopped the walk
     */
    public static boolean traverse(AstNode node, Predicate<AstNode> visitor, Order order) {
        if (order == Order.PRE && !visitor.test(node)) {
            return false;
        }
        if (node instanceof GroupNode group) {
            for (AstNode child : group.children().values()) {
                if (!traverse(child, visitor, order)) {
                    return false;
                }
            }
        }
        return order != Order.POST || visitor.test(node);
    }

    public static void visitTokens(AstNode node, Predicate<TokenNode> visitor) {
        traverse(node, current -> !(current instanceof TokenNode token) || visitor.test(token));
    }

    public static void visitGroups(AstNode node, Predicate<GroupNode> visitor) {
        traverse(node, current -> !(current instanceof GroupNode group) || visitor.test(group));
    }
}
