package work.diplomacy.kernel.api;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Applies a {@link LogLevel} to the root logger when Logback is the active SLF4J backend.
 */
public final class LoggingConfigurator {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {}

    public static void apply(LogLevel level) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext context) {
            Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            root.setLevel(Level.toLevel(level.name(), Level.WARN));
            return;
        }
        log.warn("Log level {} requested but backend {} does not support dynamic level updates",
            level, factory.getClass().getName());
    }
}
