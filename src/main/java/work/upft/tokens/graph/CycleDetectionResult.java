package work.upft.tokens.graph;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of a cycle search. The topological order is only present for acyclic graphs and lists
 * dependencies before their dependents.
 */
public record CycleDetectionResult(
    boolean hasCycles,
    List<List<String>> cycles,
    Set<String> cyclicTokens,
    Optional<List<String>> topologicalOrder
) {}
