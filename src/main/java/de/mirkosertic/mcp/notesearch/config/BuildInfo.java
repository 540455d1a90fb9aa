package de.mirkosertic.mcp.notesearch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build timestamp from the Maven-filtered build-info.properties, "dev"/"unknown" when the
 * file is missing or unfiltered (IDE runs).
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";
    private static final String DEV_VERSION = "dev";
    private static final String UNKNOWN_TIMESTAMP = "unknown";

    private static final String version;
    private static final String buildTimestamp;

    static {
        final Properties props = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input != null) {
                props.load(input);
            } else {
                logger.debug("Build info file not found, using defaults");
            }
        } catch (final IOException e) {
            logger.warn("Failed to load build info, using defaults", e);
        }
        version = valueOrDefault(props.getProperty("build.version"), DEV_VERSION);
        buildTimestamp = valueOrDefault(props.getProperty("build.timestamp"), UNKNOWN_TIMESTAMP);
        logger.debug("Build info: version={}, timestamp={}", version, buildTimestamp);
    }

    private BuildInfo() {
    }

    /**
     * Unresolved {@code ${...}} placeholders count as missing.
     */
    static String valueOrDefault(final String value, final String defaultValue) {
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return defaultValue;
        }
        return value.trim();
    }

    public static String getVersion() {
        return version;
    }

    public static String getBuildTimestamp() {
        return buildTimestamp;
    }
}
