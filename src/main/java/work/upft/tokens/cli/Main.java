package work.upft.tokens.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    static int execute(String... args) {
        return new CommandLine(new ResolveCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler())
            .execute(args);
    }
}
