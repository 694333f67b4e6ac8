package work.upft.tokens.ast;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.upft.tokens.graph.AstTraverser;
import work.upft.tokens.model.TokenReference;

/**
 * Assembles file trees into a project and records the edges between them.
 */
public final class ProjectBuilder {
    private static final Logger log = LoggerFactory.getLogger(ProjectBuilder.class);

    private ProjectBuilder() {}

    public static ProjectAst build(String basePath, Map<String, Map<String, Object>> documents) {
        var files = new ArrayList<FileAst>();
        documents.forEach((filePath, document) -> files.add(AstBuilder.buildFile(filePath, document)));
        return assemble(basePath, files);
    }

    public static ProjectAst assemble(String basePath, Collection<FileAst> fileAsts) {
        var files = new LinkedHashMap<String, FileAst>();
        for (FileAst file : fileAsts) {
            files.put(file.filePath(), file);
        }
        var edgesByFile = new LinkedHashMap<String, List<CrossFileEdge>>();
        var graph = new LinkedHashMap<String, Set<String>>();
        for (FileAst file : files.values()) {
            var edges = new ArrayList<CrossFileEdge>();
            AstTraverser.visitTokens(file, token -> {
                for (TokenReference ref : token.crossFileReferences()) {
                    var target = targetFile(file.filePath(), ref, files.keySet());
                    edges.add(new CrossFileEdge(token.path(), target, ref.path(), ref));
                }
                return true;
            });
            file.setCrossFileEdges(edges);
            var dependencies = new LinkedHashSet<String>();
            for (CrossFileEdge edge : edges) {
                if (files.containsKey(edge.toFile())) {
                    dependencies.add(edge.toFile());
                }
            }
            graph.put(file.filePath(), dependencies);
            if (!edges.isEmpty()) {
                edgesByFile.put(file.filePath(), edges);
            }
        }
        log.debug("Assembled project with {} files and {} files holding cross-file edges", files.size(), edgesByFile.size());
        return new ProjectAst(basePath, files, edgesByFile, graph);
    }

    /**
     * Project key of the file a cross-file reference points to. Relative paths are tried against the
     * referencing file's directory first, then against the project base; URLs are kept verbatim.
     */
    public static String targetFile(String sourceFile, TokenReference reference, Set<String> knownFiles) {
        var raw = reference.file();
        if (raw.startsWith("http://") || raw.startsWith("https://") || raw.startsWith("file://")) {
            return raw;
        }
        var parent = Path.of(sourceFile).getParent();
        var fromSource = normalize(parent == null ? Path.of(raw) : parent.resolve(raw));
        var fromBase = normalize(Path.of(raw));
        if (knownFiles.contains(fromSource) || !knownFiles.contains(fromBase)) {
            return fromSource;
        }
        return fromBase;
    }

    private static String normalize(Path path) {
        return path.normalize().toString().replace('\\', '/');
    }
}
