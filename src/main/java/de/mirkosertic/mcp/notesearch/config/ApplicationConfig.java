package de.mirkosertic.mcp.notesearch.config;

import de.mirkosertic.mcp.notesearch.index.SearchSettings;
import de.mirkosertic.mcp.notesearch.scoring.FuzzyMatchConfig;
import de.mirkosertic.mcp.notesearch.scoring.ScoringWeights;
import de.mirkosertic.mcp.notesearch.store.FilePatternMatcher;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Central configuration for the MCP Note Search Server.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.mcpnotesearch/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 * <p>
 * The search core never reads this class; it receives the records built by {@link #getScoringWeights()},
 * {@link #getFuzzyMatchConfig()} and {@link #getSearchSettings()}.
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    static final String ENV_CONTEXT_ROOT = "NOTESEARCH_CONTEXT_ROOT";
    static final String PROP_CONTEXT_ROOT = "notesearch.context.root";
    private static final String PROP_PROFILES_ACTIVE = "spring.profiles.active";
    private static final String CONFIG_DIR = ".mcpnotesearch";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    private final UnaryOperator<String> environment;

    // Knowledge base
    private String contextRoot;

    // Watcher settings
    private boolean watchEnabled = true;
    private long watchPollIntervalMs = 2000;
    private List<String> includePatterns = List.of("*.md");
    private List<String> excludePatterns = List.of("**/.git/**", "**/.obsidian/**", "**/node_modules/**");

    // Search settings
    private int defaultLimit = SearchSettings.DEFAULTS.defaultLimit();
    private int maxLimit = SearchSettings.DEFAULTS.maxLimit();
    private int snippetLength = SearchSettings.DEFAULTS.snippetLength();
    private int snippetContext = SearchSettings.DEFAULTS.snippetContext();
    private double similarityThreshold = SearchSettings.DEFAULTS.similarityThreshold();
    private int maxSuggestions = SearchSettings.DEFAULTS.maxSuggestions();

    // Scoring weights
    private double exactTagMatch = ScoringWeights.DEFAULTS.exactTagMatch();
    private double partialTagMatch = ScoringWeights.DEFAULTS.partialTagMatch();
    private double titleMatch = ScoringWeights.DEFAULTS.titleMatch();
    private double contentMatch = ScoringWeights.DEFAULTS.contentMatch();
    private double maxContentScore = ScoringWeights.DEFAULTS.maxContentScore();
    private double recencyBoost = ScoringWeights.DEFAULTS.recencyBoost();

    // Fuzzy matching
    private int maxEditDistance = FuzzyMatchConfig.DEFAULTS.maxEditDistance();
    private boolean includeTranspositions = FuzzyMatchConfig.DEFAULTS.includeTranspositions();
    private double minSimilarity = FuzzyMatchConfig.DEFAULTS.minSimilarity();
    private double prefixWeight = FuzzyMatchConfig.DEFAULTS.prefixWeight();

    // Profile settings
    private boolean deployedMode = false;

    ApplicationConfig(final UnaryOperator<String> environment) {
        this.environment = environment;
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig(System::getenv);

        config.loadFromClasspath();
        config.loadFromUserConfig();
        config.applyEnvironmentOverrides();
        config.determineProfile();

        logger.info("Configuration loaded: contextRoot={}, watchEnabled={}, deployedMode={}",
                config.contextRoot, config.watchEnabled, config.deployedMode);

        return config;
    }

    private static Yaml newYaml() {
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                applyYaml(is);
                logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
            }
        } catch (final IOException | YAMLException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                applyYaml(is);
                logger.debug("Loaded user config from: {}", userConfigPath);
            } catch (final IOException | YAMLException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    void applyYaml(final InputStream is) {
        final Object loaded = newYaml().load(is);
        if (loaded instanceof Map<?, ?> map) {
            applyYamlConfig(map);
        }
    }

    private void applyYamlConfig(final Map<?, ?> config) {
        final Map<?, ?> noteConfig = section(config, "notesearch");
        if (noteConfig == null) {
            return;
        }

        final Map<?, ?> contextConfig = section(noteConfig, "context");
        if (contextConfig != null && contextConfig.get("root") != null) {
            this.contextRoot = resolveVariables(contextConfig.get("root").toString());
        }

        final Map<?, ?> watcherConfig = section(noteConfig, "watcher");
        if (watcherConfig != null) {
            applyWatcherConfig(watcherConfig);
        }
        final Map<?, ?> searchConfig = section(noteConfig, "search");
        if (searchConfig != null) {
            applySearchConfig(searchConfig);
        }
        final Map<?, ?> scoringConfig = section(noteConfig, "scoring");
        if (scoringConfig != null) {
            applyScoringConfig(scoringConfig);
        }
        final Map<?, ?> fuzzyConfig = section(noteConfig, "fuzzy");
        if (fuzzyConfig != null) {
            applyFuzzyConfig(fuzzyConfig);
        }
    }

    private void applyWatcherConfig(final Map<?, ?> watcherConfig) {
        if (watcherConfig.containsKey("enabled")) {
            this.watchEnabled = (Boolean) watcherConfig.get("enabled");
        }
        if (watcherConfig.containsKey("poll-interval-ms")) {
            this.watchPollIntervalMs = ((Number) watcherConfig.get("poll-interval-ms")).longValue();
        }
        if (watcherConfig.get("include-patterns") instanceof List<?> patterns) {
            this.includePatterns = strings(patterns);
        }
        if (watcherConfig.get("exclude-patterns") instanceof List<?> patterns) {
            this.excludePatterns = strings(patterns);
        }
    }

    private void applySearchConfig(final Map<?, ?> searchConfig) {
        if (searchConfig.containsKey("default-limit")) {
            this.defaultLimit = ((Number) searchConfig.get("default-limit")).intValue();
        }
        if (searchConfig.containsKey("max-limit")) {
            this.maxLimit = ((Number) searchConfig.get("max-limit")).intValue();
        }
        if (searchConfig.containsKey("snippet-length")) {
            this.snippetLength = ((Number) searchConfig.get("snippet-length")).intValue();
        }
        if (searchConfig.containsKey("snippet-context")) {
            this.snippetContext = ((Number) searchConfig.get("snippet-context")).intValue();
        }
        if (searchConfig.containsKey("similarity-threshold")) {
            this.similarityThreshold = ((Number) searchConfig.get("similarity-threshold")).doubleValue();
        }
        if (searchConfig.containsKey("max-suggestions")) {
            this.maxSuggestions = ((Number) searchConfig.get("max-suggestions")).intValue();
        }
    }

    private void applyScoringConfig(final Map<?, ?> scoringConfig) {
        if (scoringConfig.containsKey("exact-tag-match")) {
            this.exactTagMatch = ((Number) scoringConfig.get("exact-tag-match")).doubleValue();
        }
        if (scoringConfig.containsKey("partial-tag-match")) {
            this.partialTagMatch = ((Number) scoringConfig.get("partial-tag-match")).doubleValue();
        }
        if (scoringConfig.containsKey("title-match")) {
            this.titleMatch = ((Number) scoringConfig.get("title-match")).doubleValue();
        }
        if (scoringConfig.containsKey("content-match")) {
            this.contentMatch = ((Number) scoringConfig.get("content-match")).doubleValue();
        }
        if (scoringConfig.containsKey("max-content-score")) {
            this.maxContentScore = ((Number) scoringConfig.get("max-content-score")).doubleValue();
        }
        if (scoringConfig.containsKey("recency-boost")) {
            this.recencyBoost = ((Number) scoringConfig.get("recency-boost")).doubleValue();
        }
    }

    private void applyFuzzyConfig(final Map<?, ?> fuzzyConfig) {
        if (fuzzyConfig.containsKey("max-edit-distance")) {
            this.maxEditDistance = ((Number) fuzzyConfig.get("max-edit-distance")).intValue();
        }
        if (fuzzyConfig.containsKey("include-transpositions")) {
            this.includeTranspositions = (Boolean) fuzzyConfig.get("include-transpositions");
        }
        if (fuzzyConfig.containsKey("min-similarity")) {
            this.minSimilarity = ((Number) fuzzyConfig.get("min-similarity")).doubleValue();
        }
        if (fuzzyConfig.containsKey("prefix-weight")) {
            this.prefixWeight = ((Number) fuzzyConfig.get("prefix-weight")).doubleValue();
        }
    }

    private static @Nullable Map<?, ?> section(final Map<?, ?> parent, final String key) {
        return parent.get(key) instanceof Map<?, ?> child ? child : null;
    }

    private static List<String> strings(final List<?> values) {
        final List<String> result = new ArrayList<>();
        for (final Object value : values) {
            if (value != null) {
                result.add(value.toString());
            }
        }
        return List.copyOf(result);
    }

    void applyEnvironmentOverrides() {
        final String envContextRoot = environment.apply(ENV_CONTEXT_ROOT);
        if (envContextRoot != null && !envContextRoot.trim().isEmpty()) {
            this.contextRoot = envContextRoot.trim();
            logger.info("Context root from environment: {}", this.contextRoot);
        }

        final String propContextRoot = System.getProperty(PROP_CONTEXT_ROOT);
        if (propContextRoot != null && !propContextRoot.isEmpty()) {
            this.contextRoot = propContextRoot;
        }

        if (this.contextRoot == null || this.contextRoot.isEmpty()) {
            this.contextRoot = Paths.get(System.getProperty("user.home"), "context").toString();
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILES_ACTIVE,
                System.getProperty("profile", "default"));
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = environment.apply(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    public Path getContextRoot() {
        return Paths.get(contextRoot);
    }

    public boolean isWatchEnabled() {
        return watchEnabled;
    }

    public long getWatchPollIntervalMs() {
        return watchPollIntervalMs;
    }

    public List<String> getIncludePatterns() {
        return includePatterns;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public FilePatternMatcher getFilePatternMatcher() {
        return new FilePatternMatcher(includePatterns, excludePatterns);
    }

    public SearchSettings getSearchSettings() {
        return new SearchSettings(defaultLimit, maxLimit, snippetLength, snippetContext,
                similarityThreshold, maxSuggestions);
    }

    public ScoringWeights getScoringWeights() {
        return new ScoringWeights(exactTagMatch, partialTagMatch, titleMatch, contentMatch,
                maxContentScore, recencyBoost);
    }

    public FuzzyMatchConfig getFuzzyMatchConfig() {
        return new FuzzyMatchConfig(maxEditDistance, includeTranspositions, minSimilarity, prefixWeight);
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
