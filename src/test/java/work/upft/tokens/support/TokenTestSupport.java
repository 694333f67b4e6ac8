package work.upft.tokens.support;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared helpers for building token documents in tests.
 */
public final class TokenTestSupport {
    private TokenTestSupport() {}

    public static Path projectDir(String name) {
        return Path.of("src", "test", "resources", "projects", name).toAbsolutePath();
    }

    public static Map<String, Object> token(String value) {
        var token = new LinkedHashMap<String, Object>();
        token.put("$value", value);
        return token;
    }

    public static Map<String, Object> token(String type, Object value) {
        var token = new LinkedHashMap<String, Object>();
        token.put("$type", type);
        token.put("$value", value);
        return token;
    }

    /**
     * Ordered map from alternating keys and values.
     */
    public static Map<String, Object> doc(Object... entries) {
        if (entries.length % 2 != 0) {
            throw new IllegalArgumentException("doc() needs key/value pairs");
        }
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i < entries.length; i += 2) {
            map.put((String) entries[i], entries[i + 1]);
        }
        return map;
    }
}
