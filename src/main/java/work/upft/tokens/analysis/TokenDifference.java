package work.upft.tokens.analysis;

public record TokenDifference(String path, Kind kind, Object leftValue, Object rightValue) {
    public enum Kind {
        ADDED,
        REMOVED,
        CHANGED
    }
}
