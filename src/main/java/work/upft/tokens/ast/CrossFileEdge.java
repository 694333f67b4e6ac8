package work.upft.tokens.ast;

import work.upft.tokens.model.TokenReference;

/**
 * A token in one file referencing a token in another file.
 */
public record CrossFileEdge(String fromToken, String toFile, String toToken, TokenReference reference) {
    public String literal() {
        return reference.literal();
    }
}
