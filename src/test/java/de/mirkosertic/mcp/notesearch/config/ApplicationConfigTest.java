package de.mirkosertic.mcp.notesearch.config;

import de.mirkosertic.mcp.notesearch.index.SearchSettings;
import de.mirkosertic.mcp.notesearch.scoring.FuzzyMatchConfig;
import de.mirkosertic.mcp.notesearch.scoring.ScoringWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ApplicationConfig Tests")
class ApplicationConfigTest {

    private static InputStream yaml(final String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private static ApplicationConfig configWithEnvironment(final Map<String, String> environment) {
        return new ApplicationConfig(environment::get);
    }

    @Nested
    @DisplayName("YAML")
    class Yaml {

        @Test
        @DisplayName("Defaults match the built-in records")
        void defaults() {
            final ApplicationConfig config = configWithEnvironment(Map.of());

            assertThat(config.getSearchSettings()).isEqualTo(SearchSettings.DEFAULTS);
            assertThat(config.getScoringWeights()).isEqualTo(ScoringWeights.DEFAULTS);
            assertThat(config.getFuzzyMatchConfig()).isEqualTo(FuzzyMatchConfig.DEFAULTS);
            assertThat(config.isWatchEnabled()).isTrue();
        }

        @Test
        @DisplayName("Sections override individual values")
        void overrides() {
            // Given
            final ApplicationConfig config = configWithEnvironment(Map.of());

            // When
            config.applyYaml(yaml("""
                    notesearch:
                      context:
                        root: /data/notes
                      watcher:
                        enabled: false
                        poll-interval-ms: 500
                        include-patterns: ["*.md", "*.markdown"]
                        exclude-patterns: ["**/drafts/**"]
                      search:
                        default-limit: 5
                        max-limit: 50
                        similarity-threshold: 0.5
                      scoring:
                        exact-tag-match: 40
                        recency-boost: 0
                      fuzzy:
                        max-edit-distance: 1
                        include-transpositions: false
                    """));

            // Then
            assertThat(config.getContextRoot()).isEqualTo(Paths.get("/data/notes"));
            assertThat(config.isWatchEnabled()).isFalse();
            assertThat(config.getWatchPollIntervalMs()).isEqualTo(500L);
            assertThat(config.getIncludePatterns()).containsExactly("*.md", "*.markdown");
            assertThat(config.getExcludePatterns()).containsExactly("**/drafts/**");

            final SearchSettings settings = config.getSearchSettings();
            assertThat(settings.defaultLimit()).isEqualTo(5);
            assertThat(settings.maxLimit()).isEqualTo(50);
            assertThat(settings.similarityThreshold()).isEqualTo(0.5);
            assertThat(settings.snippetLength()).isEqualTo(SearchSettings.DEFAULTS.snippetLength());

            final ScoringWeights weights = config.getScoringWeights();
            assertThat(weights.exactTagMatch()).isEqualTo(40.0);
            assertThat(weights.recencyBoost()).isEqualTo(0.0);
            assertThat(weights.titleMatch()).isEqualTo(ScoringWeights.DEFAULTS.titleMatch());

            assertThat(config.getFuzzyMatchConfig().maxEditDistance()).isEqualTo(1);
            assertThat(config.getFuzzyMatchConfig().includeTranspositions()).isFalse();
        }

        @Test
        @DisplayName("Documents without the notesearch section change nothing")
        void unrelatedDocument() {
            final ApplicationConfig config = configWithEnvironment(Map.of());

            config.applyYaml(yaml("other:\n  key: value\n"));
            config.applyYaml(yaml("- just\n- a list\n"));

            assertThat(config.getSearchSettings()).isEqualTo(SearchSettings.DEFAULTS);
        }
    }

    @Nested
    @DisplayName("Variables")
    class Variables {

        @Test
        @DisplayName("Environment variables are substituted")
        void fromEnvironment() {
            final ApplicationConfig config = configWithEnvironment(Map.of("NOTES_HOME", "/srv/notes"));

            assertThat(config.resolveVariables("${NOTES_HOME}/context")).isEqualTo("/srv/notes/context");
        }

        @Test
        @DisplayName("Defaults apply when a variable is unset")
        void defaultValue() {
            final ApplicationConfig config = configWithEnvironment(Map.of());

            assertThat(config.resolveVariables("${NOTESEARCH_UNSET_VARIABLE:/tmp/notes}"))
                    .isEqualTo("/tmp/notes");
            assertThat(config.resolveVariables("${NOTESEARCH_UNSET_VARIABLE}x")).isEqualTo("x");
        }

        @Test
        @DisplayName("Plain values and unterminated expressions are kept")
        void plainValues() {
            final ApplicationConfig config = configWithEnvironment(Map.of());

            assertThat(config.resolveVariables("/plain/path")).isEqualTo("/plain/path");
            assertThat(config.resolveVariables("${broken")).isEqualTo("${broken");
            assertThat(config.resolveVariables(null)).isNull();
        }

        @Test
        @DisplayName("System properties resolve the default root")
        void systemProperty() {
            final ApplicationConfig config = configWithEnvironment(Map.of());

            assertThat(config.resolveVariables("${user.home}/context"))
                    .isEqualTo(System.getProperty("user.home") + "/context");
        }
    }

    @Nested
    @DisplayName("Environment overrides")
    class EnvironmentOverrides {

        @Test
        @DisplayName("Environment variable wins over the YAML root")
        void environmentWins() {
            final ApplicationConfig config = configWithEnvironment(
                    Map.of(ApplicationConfig.ENV_CONTEXT_ROOT, " /env/notes "));
            config.applyYaml(yaml("notesearch:\n  context:\n    root: /yaml/notes\n"));

            config.applyEnvironmentOverrides();

            assertThat(config.getContextRoot()).isEqualTo(Paths.get("/env/notes"));
        }

        @Test
        @DisplayName("Missing root falls back to the home directory")
        void fallbackRoot() {
            final ApplicationConfig config = configWithEnvironment(Map.of());

            config.applyEnvironmentOverrides();

            assertThat(config.getContextRoot()).isEqualTo(Paths.get(System.getProperty("user.home"), "context"));
        }
    }

    @Test
    @DisplayName("Pattern matcher follows the configured patterns")
    void filePatternMatcher() {
        final ApplicationConfig config = configWithEnvironment(Map.of());

        assertThat(config.getFilePatternMatcher().shouldInclude(Paths.get("/notes/projects/site.md"))).isTrue();
        assertThat(config.getFilePatternMatcher().shouldInclude(Paths.get("/notes/.git/HEAD.md"))).isFalse();
    }
}
