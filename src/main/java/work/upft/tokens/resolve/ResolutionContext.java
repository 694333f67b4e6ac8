package work.upft.tokens.resolve;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.upft.tokens.ast.CrossFileEdge;
import work.upft.tokens.ast.FileAst;
import work.upft.tokens.ast.ProjectAst;
import work.upft.tokens.ast.TokenNode;
import work.upft.tokens.model.TokenReference;
import work.upft.tokens.model.TypedValue;

/**
 * State of one resolution call. Tokens are keyed as {@code file:path}.
 */
final class ResolutionContext {
    private final ProjectAst project;
    private final int maxDepth;
    private final Map<String, TypedValue> memo = new HashMap<>();
    private final Map<String, TypedValue> working = new HashMap<>();
    private final Map<String, Set<TokenReference>> substituted = new HashMap<>();
    private final Map<String, CrossFileEdge> edges = new HashMap<>();
    private final Set<String> visiting = new HashSet<>();
    private final Set<String> failed = new HashSet<>();
    private final Set<String> reported = new HashSet<>();
    private final List<ResolutionError> errors = new ArrayList<>();
    private int depth;

    ResolutionContext(ProjectAst project, int maxDepth) {
        this.project = project;
        this.maxDepth = maxDepth;
        project.crossFileReferences().forEach((file, fileEdges) -> {
            for (CrossFileEdge edge : fileEdges) {
                edges.put(key(file, edge.fromToken()) + "#" + edge.literal(), edge);
            }
        });
    }

    static String key(String file, String path) {
        return file + ":" + path;
    }

    static String key(FileAst file, TokenNode token) {
        return key(file.filePath(), token.path());
    }

    ProjectAst project() {
        return project;
    }

    /**
     * Failures are only final within one pass; later passes may find the missing pieces.
     */
    void beginPass() {
        failed.clear();
        visiting.clear();
        depth = 0;
    }

    Optional<TypedValue> memoized(String key) {
        return Optional.ofNullable(memo.get(key));
    }

    boolean hasFailed(String key) {
        return failed.contains(key);
    }

    void markFailed(String key) {
        failed.add(key);
    }

    boolean isVisiting(String key) {
        return visiting.contains(key);
    }

    boolean depthExceeded() {
        return depth >= maxDepth;
    }

    int maxDepth() {
        return maxDepth;
    }

    void enter(String key) {
        visiting.add(key);
        depth++;
    }

    void exit(String key) {
        visiting.remove(key);
        depth--;
    }

    Optional<CrossFileEdge> edge(FileAst file, TokenNode token, TokenReference reference) {
        return Optional.ofNullable(edges.get(key(file, token) + "#" + reference.literal()));
    }

    TypedValue workingValue(String key, TokenNode token) {
        return working.getOrDefault(key, token.typedValue());
    }

    boolean isSubstituted(String key, TokenReference reference) {
        return substituted.getOrDefault(key, Set.of()).contains(reference);
    }

    void substitute(String key, TokenNode token, TokenReference reference, TypedValue value) {
        working.put(key, ValueSubstitution.replace(workingValue(key, token), reference, value));
        substituted.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(reference);
    }

    /**
     * Marks the token resolved once every one of its references has been substituted.
     */
    Optional<TypedValue> completeIfDone(String key, TokenNode token) {
        if (token.isResolved()) {
            return token.resolvedValue();
        }
        var done = substituted.getOrDefault(key, Set.of());
        if (!done.containsAll(token.references())) {
            return Optional.empty();
        }
        var value = workingValue(key, token);
        token.markResolved(value);
        memo.put(key, value);
        return Optional.of(value);
    }

    void error(ResolutionError error) {
        var dedupe = error.kind() + "|" + error.filePath() + "|" + error.path() + "|" + error.reference();
        if (error.kind() == ResolutionError.Kind.CIRCULAR) {
            dedupe = error.kind() + "|" + error.filePath() + "|" + error.path();
        }
        if (reported.add(dedupe)) {
            errors.add(error);
        }
    }

    List<ResolutionError> errors() {
        return errors;
    }
}
