package work.upft.tokens.analysis;

import java.util.List;
import java.util.Map;

public record TokenAnalysis(
    int tokenCount,
    int groupCount,
    Map<String, Integer> tokensByType,
    int depth,
    int referenceCount,
    int tokensWithReferences,
    List<String> unresolvedReferences,
    List<String> circularReferences
) {
    public boolean hasReferences() {
        return tokensWithReferences > 0;
    }
}
