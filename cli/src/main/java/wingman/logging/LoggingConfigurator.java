package wingman.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Adjusts the Logback root level from command-line flags.
 *
 * <p>Other SLF4J bindings keep their own configuration; a warning names the backend.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {
    }

    /**
     * Raises the root logger to DEBUG.
     */
    public static void enableVerboseLogging() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext context) {
            Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            if (!Level.DEBUG.equals(root.getLevel())) {
                root.setLevel(Level.DEBUG);
            }
            return;
        }
        log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
                factory.getClass().getName());
    }
}
