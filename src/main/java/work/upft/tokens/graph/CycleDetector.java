package work.upft.tokens.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.upft.tokens.ast.AstNode;
import work.upft.tokens.model.TokenReference;

/**
 * Reference cycle detection with Tarjan's strongly connected components.
 */
public final class CycleDetector {
    private CycleDetector() {}

    public static CycleDetectionResult detectCycles(AstNode root) {
        return detect(referenceGraph(root));
    }

    /**
     * Every token path mapped to the keys of the tokens it references.
     */
    public static Map<String, List<String>> referenceGraph(AstNode root) {
        var graph = new LinkedHashMap<String, List<String>>();
        AstTraverser.visitTokens(root, token -> {
            graph.put(token.path(), token.references().stream().map(TokenReference::key).toList());
            return true;
        });
        return graph;
    }

    /**
     * Targets that are not keys of {@code graph} take part in cycle search but are left out of the
     * topological order.
     */
    public static CycleDetectionResult detect(Map<String, ? extends Collection<String>> graph) {
        var nodes = new LinkedHashSet<String>();
        graph.forEach((node, edges) -> {
            nodes.add(node);
            nodes.addAll(edges);
        });
        var tarjan = new Tarjan(graph);
        for (String node : nodes) {
            if (!tarjan.indices.containsKey(node)) {
                tarjan.connect(node);
            }
        }

        var cycles = new ArrayList<List<String>>();
        var cyclic = new LinkedHashSet<String>();
        for (List<String> component : tarjan.components) {
            boolean selfLoop = component.size() == 1 && edgesOf(graph, component.get(0)).contains(component.get(0));
            if (component.size() > 1 || selfLoop) {
                var cycle = new ArrayList<>(component);
                Collections.reverse(cycle);
                cycles.add(List.copyOf(cycle));
                cyclic.addAll(cycle);
            }
        }
        if (!cycles.isEmpty()) {
            return new CycleDetectionResult(true, List.copyOf(cycles), Collections.unmodifiableSet(cyclic), Optional.empty());
        }
        var order = new ArrayList<String>();
        for (List<String> component : tarjan.components) {
            for (String node : component) {
                if (graph.containsKey(node)) {
                    order.add(node);
                }
            }
        }
        return new CycleDetectionResult(false, List.of(), Set.of(), Optional.of(List.copyOf(order)));
    }

    private static Collection<String> edgesOf(Map<String, ? extends Collection<String>> graph, String node) {
        Collection<String> edges = graph.get(node);
        return edges == null ? List.of() : edges;
    }

    // Components complete in reverse topological order of the condensation, so referenced
    // tokens always come out before the tokens that reference them.
    private static final class Tarjan {
        final Map<String, ? extends Collection<String>> graph;
        final Map<String, Integer> indices = new HashMap<>();
        final Map<String, Integer> lowLinks = new HashMap<>();
        final Deque<String> stack = new ArrayDeque<>();
        final Set<String> onStack = new HashSet<>();
        final List<List<String>> components = new ArrayList<>();
        int index;

        Tarjan(Map<String, ? extends Collection<String>> graph) {
            this.graph = graph;
        }

        void connect(String node) {
            indices.put(node, index);
            lowLinks.put(node, index);
            index++;
            stack.push(node);
            onStack.add(node);

            for (String next : edgesOf(graph, node)) {
                if (!indices.containsKey(next)) {
                    connect(next);
                    lowLinks.put(node, Math.min(lowLinks.get(node), lowLinks.get(next)));
                } else if (onStack.contains(next)) {
                    lowLinks.put(node, Math.min(lowLinks.get(node), indices.get(next)));
                }
            }

            if (lowLinks.get(node).equals(indices.get(node))) {
                var component = new ArrayList<String>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.add(member);
                } while (!member.equals(node));
                components.add(component);
            }
        }
    }
}
