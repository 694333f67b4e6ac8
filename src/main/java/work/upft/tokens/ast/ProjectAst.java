package work.upft.tokens.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.upft.tokens.graph.CycleDetector;
import work.upft.tokens.manifest.Manifest;

/**
 * A set of token files, their cross-file edges and the file dependency graph.
 */
public final class ProjectAst {
    private final String basePath;
    private final Map<String, FileAst> files;
    private final Map<String, List<CrossFileEdge>> crossFileReferences;
    private final Map<String, Set<String>> dependencyGraph;
    private Manifest manifest;

    ProjectAst(String basePath, Map<String, FileAst> files, Map<String, List<CrossFileEdge>> crossFileReferences, Map<String, Set<String>> dependencyGraph) {
        this.basePath = basePath == null ? "" : basePath;
        this.files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
        this.crossFileReferences = Collections.unmodifiableMap(new LinkedHashMap<>(crossFileReferences));
        this.dependencyGraph = Collections.unmodifiableMap(new LinkedHashMap<>(dependencyGraph));
    }

    public String basePath() {
        return basePath;
    }

    public Map<String, FileAst> files() {
        return files;
    }

    public Optional<FileAst> file(String filePath) {
        return Optional.ofNullable(files.get(filePath));
    }

    public Map<String, List<CrossFileEdge>> crossFileReferences() {
        return crossFileReferences;
    }

    public Map<String, Set<String>> dependencyGraph() {
        return dependencyGraph;
    }

    public Optional<Manifest> manifest() {
        return Optional.ofNullable(manifest);
    }

    public void attachManifest(Manifest manifest) {
        this.manifest = manifest;
    }

    /**
     * Files ordered so that referenced files come before the files that reference them. Cycles are
     * broken at the first revisit.
     */
    public List<String> resolutionOrder() {
        var visited = new HashSet<String>();
        var order = new ArrayList<String>();
        for (String file : files.keySet()) {
            visit(file, visited, order);
        }
        return order;
    }

    private void visit(String file, Set<String> visited, List<String> order) {
        if (!visited.add(file)) {
            return;
        }
        for (String dependency : dependencyGraph.getOrDefault(file, Set.of())) {
            visit(dependency, visited, order);
        }
        order.add(file);
    }

    /**
     * Groups of files that reference each other in a loop.
     */
    public List<List<String>> circularFileDependencies() {
        var graph = new LinkedHashMap<String, List<String>>();
        dependencyGraph.forEach((file, deps) -> graph.put(file, new ArrayList<>(new LinkedHashSet<>(deps))));
        return CycleDetector.detect(graph).cycles();
    }
}
