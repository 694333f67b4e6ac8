package work.upft.tokens.permutation;

/**
 * Two documents disagree on a token's declared type.
 */
public final class MergeConflictException extends RuntimeException {
    private final String path;

    public MergeConflictException(String path, String message) {
        super(message + " at " + path);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
