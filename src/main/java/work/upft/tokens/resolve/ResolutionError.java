package work.upft.tokens.resolve;

/**
 * A reference that could not be resolved. Collected, never thrown.
 */
public record ResolutionError(Kind kind, String path, String message, String reference, String filePath, String targetFile) {
    public enum Kind {
        MISSING("missing"),
        CIRCULAR("circular"),
        INVALID("invalid"),
        CROSS_FILE("cross-file"),
        DEPTH("depth");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public static ResolutionError of(Kind kind, String path, String message, String reference, String filePath) {
        return new ResolutionError(kind, path, message, reference, filePath, null);
    }

    public static ResolutionError crossFile(String path, String message, String reference, String filePath, String targetFile) {
        return new ResolutionError(Kind.CROSS_FILE, path, message, reference, filePath, targetFile);
    }

    public String describe() {
        return "[" + kind.label() + "] " + path + ": " + message;
    }
}
