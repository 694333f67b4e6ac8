package work.upft.tokens.manifest;

import java.util.List;

/**
 * A manifest, its input or its resolution failed. Carries every underlying problem.
 */
public class ManifestException extends RuntimeException {
    private final String headline;
    private final List<String> problems;

    public ManifestException(String headline, List<String> problems) {
        super(format(headline, problems));
        this.headline = headline;
        this.problems = List.copyOf(problems);
    }

    public String headline() {
        return headline;
    }

    public List<String> problems() {
        return problems;
    }

    private static String format(String headline, List<String> problems) {
        var builder = new StringBuilder(headline).append(':');
        for (String problem : problems) {
            builder.append("\n  - ").append(problem);
        }
        return builder.toString();
    }
}
