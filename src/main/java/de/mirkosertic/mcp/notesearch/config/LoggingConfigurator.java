package de.mirkosertic.mcp.notesearch.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches logging to file-only output in deployed mode.
 * <p>
 * With the STDIO transport STDOUT carries JSON-RPC, so logback-deployed.xml writes to
 * ~/.mcpnotesearch/log only. Development mode keeps logback.xml, which logs to STDERR.
 */
public final class LoggingConfigurator {

    private static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before the first logger is used.
     *
     * @param deployedMode true if running in deployed mode (STDIO transport)
     */
    public static void configure(final boolean deployedMode) {
        if (deployedMode) {
            ensureLogDirectoryExists(getLogDirectory());
            loadConfiguration(DEPLOYED_CONFIG);
        }
    }

    public static Path getLogDirectory() {
        return ApplicationConfig.getConfigDirectory().resolve("log");
    }

    static void ensureLogDirectoryExists(final Path logDir) {
        try {
            Files.createDirectories(logDir);
        } catch (final IOException e) {
            // logging is not configured yet
            System.err.println("Warning: Could not create log directory: " + logDir);
        }
    }

    private static void loadConfiguration(final String configFile) {
        try {
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.reset();

            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);

            try (InputStream configStream = LoggingConfigurator.class.getClassLoader()
                    .getResourceAsStream(configFile)) {
                if (configStream != null) {
                    configurator.doConfigure(configStream);
                } else {
                    System.err.println("Warning: Could not find " + configFile + " on classpath");
                }
            }
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        }
    }
}
