package de.mirkosertic.mwe.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build timestamp of the recognizer, read from the Maven-filtered
 * {@code build-info.properties}. Outside a Maven build (IDE runs) the values are
 * {@code "dev"} and {@code "unknown"}.
 *
 * @param version        project version
 * @param buildTimestamp ISO-8601 build time
 */
public record BuildInfo(String version, String buildTimestamp) {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";
    private static final String DEFAULT_VERSION = "dev";
    private static final String DEFAULT_TIMESTAMP = "unknown";

    private static final class Holder {
        private static final BuildInfo CURRENT = readFromClasspath();
    }

    public static BuildInfo current() {
        return Holder.CURRENT;
    }

    public static String getVersion() {
        return current().version();
    }

    public static String getBuildTimestamp() {
        return current().buildTimestamp();
    }

    /**
     * One-line description for {@code --version} output.
     */
    public String describe() {
        return "mwe-recognizer " + version + " (built " + buildTimestamp + ")";
    }

    static BuildInfo readFromClasspath() {
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input == null) {
                logger.debug("Build info file not found, using defaults (IDE/dev mode)");
                return new BuildInfo(DEFAULT_VERSION, DEFAULT_TIMESTAMP);
            }
            final Properties props = new Properties();
            props.load(input);
            return new BuildInfo(
                    valueOrDefault(props.getProperty("build.version"), DEFAULT_VERSION),
                    valueOrDefault(props.getProperty("build.timestamp"), DEFAULT_TIMESTAMP));
        } catch (final IOException e) {
            logger.warn("Failed to load build info, using defaults", e);
            return new BuildInfo(DEFAULT_VERSION, DEFAULT_TIMESTAMP);
        }
    }

    private static String valueOrDefault(final String value, final String defaultValue) {
        // unfiltered resources still contain the ${...} placeholder
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return defaultValue;
        }
        return value;
    }
}
