package work.upft.tokens.ast;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Base of the token tree. Nodes only know their own path; the parent is found through the owning tree.
 */
public abstract class AstNode {
    public static final String ROOT_NAME = "root";

    private final String path;
    private final String name;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    protected AstNode(String path) {
        this.path = path == null ? "" : path;
        int dot = this.path.lastIndexOf('.');
        this.name = this.path.isEmpty() ? ROOT_NAME : this.path.substring(dot + 1);
    }

    public String path() {
        return path;
    }

    public String name() {
        return name;
    }

    public boolean isRoot() {
        return path.isEmpty();
    }

    /**
     * Path of the enclosing group; {@code ""} for top-level nodes, empty for the root itself.
     */
    public Optional<String> parentPath() {
        if (isRoot()) {
            return Optional.empty();
        }
        int dot = path.lastIndexOf('.');
        return Optional.of(dot < 0 ? "" : path.substring(0, dot));
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public Optional<String> description() {
        return metadata.get("description") instanceof String text ? Optional.of(text) : Optional.empty();
    }

    public abstract boolean isToken();

    static String childPath(String parent, String key) {
        return parent == null || parent.isEmpty() ? key : parent + "." + key;
    }
}
