package work.upft.tokens.manifest;

import java.util.List;
import java.util.Optional;

/**
 * Files that are always part of every permutation.
 */
public record TokenSet(Optional<String> name, List<String> files, Optional<String> description) {
    public TokenSet {
        files = List.copyOf(files);
    }
}
