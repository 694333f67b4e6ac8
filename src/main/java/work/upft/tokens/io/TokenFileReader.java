package work.upft.tokens.io;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Source of token and manifest documents, keyed by the paths manifests use.
 */
@FunctionalInterface
public interface TokenFileReader {
    Map<String, Object> read(String path) throws IOException;

    /**
     * Serves documents from memory; unknown paths fail with {@link NoSuchFileException}.
     */
    static TokenFileReader inMemory(Map<String, Map<String, Object>> documents) {
        var snapshot = new LinkedHashMap<>(documents);
        return path -> {
            var document = snapshot.get(path);
            if (document == null) {
                throw new NoSuchFileException(path);
            }
            return JsonValues.copyObject(document);
        };
    }
}
