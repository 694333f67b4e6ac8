package work.upft.tokens.model;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A normalized reference from one token to another, either inside the same file or across files.
 *
 * <p>Local references always carry the canonical {@code {a.b.c}} literal, so two spellings of the
 * same alias ({@code {a/b/c}}, {@code #/a/b/c/$value}) compare equal. Cross-file references keep the
 * literal as written.
 */
public record TokenReference(Kind kind, String literal, String file, String path) {
    private static final Pattern ALIAS = Pattern.compile("^\\{([^{}]+)}$");
    private static final Pattern POINTER = Pattern.compile("^#/(.+)$");
    private static final Pattern CROSS_FILE = Pattern.compile("^((?:\\.{1,2}/|file://|https?://)[^#]+\\.(?:json|ya?ml))#(.+)$");

    public enum Kind {
        LOCAL,
        CROSS_FILE
    }

    public TokenReference {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(literal, "literal");
        Objects.requireNonNull(path, "path");
    }

    public static TokenReference local(String path) {
        var normalized = normalizePath(path);
        return new TokenReference(Kind.LOCAL, "{" + normalized + "}", null, normalized);
    }

    public static TokenReference crossFile(String literal, String file, String path) {
        return new TokenReference(Kind.CROSS_FILE, literal, file, normalizePath(path));
    }

    /**
     * Classifies a whole string as a reference; empty when it is a plain value.
     */
    public static Optional<TokenReference> parse(String literal) {
        if (literal == null) {
            return Optional.empty();
        }
        var text = literal.trim();
        var cross = CROSS_FILE.matcher(text);
        if (cross.matches()) {
            return Optional.of(crossFile(text, cross.group(1), cross.group(2)));
        }
        var pointer = POINTER.matcher(text);
        if (pointer.matches()) {
            return Optional.of(local(pointer.group(1)));
        }
        var alias = ALIAS.matcher(text);
        if (alias.matches()) {
            return Optional.of(local(alias.group(1)));
        }
        return Optional.empty();
    }

    /**
     * Turns {@code a/b}, {@code /a/b/$value} or {@code a.b} into the dot path {@code a.b}.
     */
    public static String normalizePath(String raw) {
        var path = raw.trim().replace('/', '.');
        while (path.startsWith(".")) {
            path = path.substring(1);
        }
        if (path.endsWith(".$value")) {
            path = path.substring(0, path.length() - ".$value".length());
        }
        return path;
    }

    public boolean isLocal() {
        return kind == Kind.LOCAL;
    }

    public boolean isCrossFile() {
        return kind == Kind.CROSS_FILE;
    }

    /**
     * Graph key: the dot path for local references, {@code file#path} otherwise.
     */
    public String key() {
        return isLocal() ? path : file + "#" + path;
    }

    @Override
    public String toString() {
        return literal;
    }
}
