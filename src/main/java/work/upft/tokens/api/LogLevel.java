package work.upft.tokens.api;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;

/**
 * Root logging threshold for a run. Resolver traces are logged at debug, unloaded remote
 * references at warn.
 */
public enum LogLevel {
    TRACE(Level.TRACE),
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR),
    OFF(Level.OFF);

    private final Level threshold;

    LogLevel(Level threshold) {
        this.threshold = threshold;
    }

    /**
     * Empty for a blank value, so the bundled log4j2 configuration stays in charge.
     */
    public static Optional<LogLevel> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        var name = value.trim().toUpperCase(Locale.ROOT);
        for (LogLevel level : values()) {
            if (level.name().equals(name)) {
                return Optional.of(level);
            }
        }
        var accepted = Arrays.stream(values()).map(level -> level.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining("|"));
        throw new IllegalArgumentException("Unsupported log level '" + value + "', expected " + accepted);
    }

    public Level threshold() {
        return threshold;
    }

    void apply() {
        Configurator.setRootLevel(threshold);
    }
}
