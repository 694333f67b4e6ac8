package work.upft.tokens.cli;

import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;
import work.upft.tokens.manifest.ManifestException;

/**
 * Reports a failed resolution on stderr: one headline, then one line per manifest, input or
 * reference problem. {@code -Dupft.debug=true} adds the stack trace.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "upft.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        var err = commandLine.getErr();
        for (String line : describe(ex)) {
            err.println(commandLine.getColorScheme().errorText(line));
        }
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(err);
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static List<String> describe(Exception ex) {
        if (ex instanceof ManifestException manifestFailure) {
            var lines = new ArrayList<String>();
            lines.add(manifestFailure.headline() + ":");
            manifestFailure.problems().forEach(problem -> lines.add("  - " + problem));
            return lines;
        }
        if (ex instanceof NoSuchFileException missing) {
            return List.of("Token file not found: " + missing.getFile());
        }
        var message = ex.getMessage();
        return List.of(message == null || message.isBlank() ? ex.getClass().getSimpleName() : message);
    }
}
