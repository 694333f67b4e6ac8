package work.upft.tokens.ast;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The tree of one token file plus its outgoing cross-file edges.
 */
public final class FileAst extends GroupNode {
    public static final String INLINE_PATH = "inline.json";

    private final String filePath;
    private List<CrossFileEdge> crossFileEdges = List.of();
    private String checksum;
    private Instant lastModified;

    public FileAst(String filePath) {
        super("");
        this.filePath = Objects.requireNonNull(filePath, "filePath");
    }

    /**
     * Presents an already built tree as a file; the nodes are shared, not copied.
     */
    public static FileAst wrap(String filePath, GroupNode root) {
        var file = new FileAst(filePath);
        file.adoptChildren(root);
        return file;
    }

    public String filePath() {
        return filePath;
    }

    public List<CrossFileEdge> crossFileEdges() {
        return crossFileEdges;
    }

    void setCrossFileEdges(List<CrossFileEdge> edges) {
        this.crossFileEdges = List.copyOf(edges);
    }

    public Optional<String> checksum() {
        return Optional.ofNullable(checksum);
    }

    void setChecksum(String checksum) {
        this.checksum = checksum;
    }

    public Optional<Instant> lastModified() {
        return Optional.ofNullable(lastModified);
    }

    public void setLastModified(Instant lastModified) {
        this.lastModified = lastModified;
    }
}
