package de.mirkosertic.mcp.notesearch;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.notesearch.config.ApplicationConfig;
import de.mirkosertic.mcp.notesearch.config.BuildInfo;
import de.mirkosertic.mcp.notesearch.config.LoggingConfigurator;
import de.mirkosertic.mcp.notesearch.index.SearchEngine;
import de.mirkosertic.mcp.notesearch.store.MarkdownDocumentStore;
import de.mirkosertic.mcp.notesearch.watcher.IndexUpdatingListener;
import de.mirkosertic.mcp.notesearch.watcher.NoteFileWatcher;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;

/**
 * Main entry point for the MCP Note Search Server.
 * Builds the index over the configured knowledge base and serves the search tools over STDIO.
 */
public class NotesearchApplication {

    private static final Logger logger = LoggerFactory.getLogger(NotesearchApplication.class);

    private final ApplicationConfig config;
    private final MarkdownDocumentStore documentStore;
    private final SearchEngine searchEngine;
    private final NoteSearchTools searchTools;
    private NoteFileWatcher fileWatcher;
    private McpSyncServer mcpServer;

    public NotesearchApplication(final ApplicationConfig config) {
        this.config = config;
        this.documentStore = new MarkdownDocumentStore(config.getContextRoot(), config.getFilePatternMatcher());
        this.searchEngine = new SearchEngine(
                documentStore,
                config.getScoringWeights(),
                config.getFuzzyMatchConfig(),
                config.getSearchSettings(),
                Clock.systemUTC());
        this.searchTools = new NoteSearchTools(searchEngine, documentStore.getRoot());
    }

    /**
     * Builds the index and starts watching the knowledge base.
     */
    public void init() throws SearchException, IOException {
        logger.info("Initializing MCP Note Search Server for {}", documentStore.getRoot());

        searchEngine.initialize();

        if (config.isWatchEnabled() && Files.isDirectory(documentStore.getRoot())) {
            fileWatcher = new NoteFileWatcher(
                    documentStore.getRoot(),
                    documentStore.getPatternMatcher(),
                    new IndexUpdatingListener(searchEngine, documentStore),
                    config.getWatchPollIntervalMs());
            fileWatcher.start();
        }

        logger.info("All services initialized successfully");
    }

    /**
     * Starts the MCP server and blocks until the process is stopped.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                "MCP Note Search Server",
                BuildInfo.getVersion()
        );

        final JacksonMcpJsonMapper jsonMapper = new JacksonMcpJsonMapper(new ObjectMapper());
        final StdioServerTransportProvider transportProvider = new StdioServerTransportProvider(jsonMapper);

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(searchTools.getToolSpecifications())
                .build();

        logger.info("MCP server started successfully");

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));
        monitorParentProcess();

        // The STDIO transport handles communication, keep the main thread alive
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    /**
     * Exits when the client that spawned this process goes away.
     */
    private void monitorParentProcess() {
        ProcessHandle.current().parent().ifPresent(parent -> {
            parent.onExit().thenRun(() -> {
                logger.info("Parent process terminated, shutting down...");
                System.exit(0);
            });
            logger.info("Monitoring parent process PID: {}", parent.pid());
        });
    }

    public void shutdown() {
        logger.info("Shutting down MCP Note Search Server...");

        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }

        if (fileWatcher != null) {
            fileWatcher.close();
        }

        logger.info("MCP Note Search Server shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Logging first: in deployed mode STDOUT belongs to JSON-RPC
            final String profile = System.getProperty("spring.profiles.active", System.getProperty("profile", ""));
            final boolean deployedMode = "deployed".equalsIgnoreCase(profile);
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();

            if (!deployedMode) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Context root: {}", config.getContextRoot());
            }

            final NotesearchApplication app = new NotesearchApplication(config);
            app.init();
            app.start();

        } catch (final Exception e) {
            // In deployed mode, we can't log to console, so write to stderr
            System.err.println("Failed to start MCP Note Search Server: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
