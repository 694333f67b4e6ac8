package work.upft.tokens.ast;

/**
 * Raised when a token document cannot be turned into a tree.
 */
public final class AstBuildException extends RuntimeException {
    private final String path;

    public AstBuildException(String path, String message) {
        super(path == null || path.isEmpty() ? message : message + " at " + path);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
