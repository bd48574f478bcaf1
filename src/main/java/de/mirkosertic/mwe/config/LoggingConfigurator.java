package de.mirkosertic.mwe.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.jspecify.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configures logging for the command line front end.
 * <p>
 * The default {@code logback.xml} logs to standard error, so that standard output only carries
 * JSON results. In quiet mode {@code logback-quiet.xml} is loaded instead, which writes to
 * {@code ~/.mwe/log} only. The {@code LOG_LEVEL} environment variable adjusts the level of the
 * {@code de.mirkosertic.mwe} loggers in both modes.
 */
public final class LoggingConfigurator {

    private static final Path LOG_DIR = Paths.get(System.getProperty("user.home"), ".mwe", "log");
    private static final String QUIET_CONFIG = "logback-quiet.xml";
    private static final String ENV_LOG_LEVEL = "LOG_LEVEL";
    private static final String ROOT_PACKAGE = "de.mirkosertic.mwe";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before the first logger is used.
     *
     * @param quiet true to log to file only
     */
    public static void configure(final boolean quiet) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        if (quiet) {
            createLogDirectory();
            reconfigure(context, QUIET_CONFIG);
        }
        applyLevel(context, System.getenv(ENV_LOG_LEVEL));
    }

    static void applyLevel(final LoggerContext context, final @Nullable String levelName) {
        if (levelName == null || levelName.isBlank()) {
            return;
        }
        // Level.toLevel falls back to DEBUG for unknown names, which is too chatty
        final Level level = Level.toLevel(levelName.trim(), Level.INFO);
        context.getLogger(ROOT_PACKAGE).setLevel(level);
    }

    private static void createLogDirectory() {
        try {
            Files.createDirectories(LOG_DIR);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + LOG_DIR + ": " + e.getMessage());
        }
    }

    private static void reconfigure(final LoggerContext context, final String configFile) {
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath, keeping default logging");
                return;
            }
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration " + configFile + ": " + e.getMessage());
        }
    }
}
