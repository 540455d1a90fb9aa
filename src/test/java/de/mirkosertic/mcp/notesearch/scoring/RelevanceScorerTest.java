package de.mirkosertic.mcp.notesearch.scoring;

import de.mirkosertic.mcp.notesearch.index.Category;
import de.mirkosertic.mcp.notesearch.index.IndexedDocument;
import de.mirkosertic.mcp.notesearch.index.SearchQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("RelevanceScorer Tests")
class RelevanceScorerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private final RelevanceScorer scorer = new RelevanceScorer(ScoringWeights.DEFAULTS,
            Clock.fixed(NOW, ZoneOffset.UTC));

    private static IndexedDocument document(final String title, final String content, final List<String> tags,
                                            final Instant modified) {
        return IndexedDocument.of("resources/note.md", title, content, tags, Category.RESOURCES, null, modified);
    }

    @Nested
    @DisplayName("Tags")
    class Tags {

        @Test
        @DisplayName("Each exactly matching tag adds the exact weight")
        void exactTags() {
            // Given
            final IndexedDocument doc = document("JS", "", List.of("javascript", "typescript", "testing"), null);

            // When
            final double score = scorer.calculateScore(doc,
                    SearchQuery.builder().tags("javascript", "testing").build());

            // Then
            assertThat(score).isEqualTo(60.0);
        }

        @Test
        @DisplayName("Containment either way is a partial match")
        void partialTags() {
            final IndexedDocument doc = document("JS", "", List.of("javascript"), null);

            assertThat(scorer.calculateScore(doc, SearchQuery.builder().tags("script").build())).isEqualTo(15.0);
            assertThat(scorer.calculateScore(doc, SearchQuery.builder().tags("javascript-testing").build()))
                    .isEqualTo(15.0);
        }

        @Test
        @DisplayName("Tag comparison ignores case")
        void caseInsensitive() {
            final IndexedDocument doc = document("JS", "", List.of("JavaScript"), null);

            assertThat(scorer.calculateScore(doc, SearchQuery.builder().tags("JAVASCRIPT").build())).isEqualTo(30.0);
        }
    }

    @Nested
    @DisplayName("Title")
    class Title {

        @Test
        @DisplayName("Equal title scores double")
        void equalTitle() {
            final IndexedDocument doc = document("Weekly Meeting", "", List.of(), null);

            assertThat(scorer.calculateScore(doc, SearchQuery.builder().title("weekly meeting").build()))
                    .isEqualTo(50.0);
        }

        @Test
        @DisplayName("Contained title scores once")
        void containedTitle() {
            final IndexedDocument doc = document("Weekly Meeting Notes", "", List.of(), null);

            assertThat(scorer.calculateScore(doc, SearchQuery.builder().title("meeting").build())).isEqualTo(25.0);
        }

        @Test
        @DisplayName("Otherwise the share of query words found counts")
        void wordOverlap() {
            final IndexedDocument doc = document("Weekly Meeting Notes", "", List.of(), null);

            // 1 of 2 words: 12.5 rounded
            assertThat(scorer.calculateScore(doc, SearchQuery.builder().title("meeting agenda").build()))
                    .isEqualTo(13.0);
        }
    }

    @Nested
    @DisplayName("Content")
    class Content {

        @Test
        @DisplayName("Phrase occurrences are counted")
        void phraseOccurrences() {
            final IndexedDocument doc = document("Hooks", "React hooks are neat. More react hooks later.",
                    List.of(), null);

            assertThat(scorer.calculateScore(doc, SearchQuery.builder().content("react hooks").build()))
                    .isEqualTo(20.0);
        }

        @Test
        @DisplayName("Missing phrase falls back to single words")
        void wordFallback() {
            final IndexedDocument doc = document("Hooks", "React is nice. Hooks are fun. React again.",
                    List.of(), null);

            assertThat(scorer.calculateScore(doc, SearchQuery.builder().content("react hooks").build()))
                    .isEqualTo(30.0);
        }

        @Test
        @DisplayName("Content score is capped")
        void capped() {
            final IndexedDocument doc = document("Spam", "todo ".repeat(10), List.of(), null);

            assertThat(scorer.calculateScore(doc, SearchQuery.builder().content("todo").build())).isEqualTo(50.0);
        }
    }

    @Nested
    @DisplayName("Recency")
    class Recency {

        @Test
        @DisplayName("Full boost today, partial after half a year, none after a year")
        void decay() {
            assertThat(scorer.recencyScore(NOW, ScoringWeights.DEFAULTS)).isCloseTo(1.0, within(1e-9));
            assertThat(scorer.recencyScore(NOW.minus(Duration.ofDays(180)), ScoringWeights.DEFAULTS))
                    .isBetween(0.4, 0.6);
            assertThat(scorer.recencyScore(NOW.minus(Duration.ofDays(365)), ScoringWeights.DEFAULTS)).isEqualTo(0.0);
            assertThat(scorer.recencyScore(NOW.minus(Duration.ofDays(400)), ScoringWeights.DEFAULTS)).isEqualTo(0.0);
            assertThat(scorer.recencyScore(null, ScoringWeights.DEFAULTS)).isEqualTo(0.0);
        }

        @Test
        @DisplayName("Decay is monotonic")
        void monotonic() {
            double previous = Double.MAX_VALUE;
            for (int days = 0; days <= 365; days += 5) {
                final double boost = scorer.recencyScore(NOW.minus(Duration.ofDays(days)), ScoringWeights.DEFAULTS);
                assertThat(boost).isLessThanOrEqualTo(previous);
                previous = boost;
            }
        }

        @Test
        @DisplayName("Future dates get the full boost")
        void futureDate() {
            assertThat(scorer.recencyScore(NOW.plus(Duration.ofDays(3)), ScoringWeights.DEFAULTS))
                    .isCloseTo(1.0, within(1e-9));
        }

        @Test
        @DisplayName("Recency adds to the score but is not a text match")
        void recencyIsNotATextMatch() {
            final IndexedDocument doc = document("Other", "unrelated", List.of("javascript"), NOW);
            final SearchQuery matching = SearchQuery.builder().tags("javascript").build();
            final SearchQuery missing = SearchQuery.builder().tags("python").build();

            assertThat(scorer.calculateScore(doc, matching)).isEqualTo(31.0);
            assertThat(scorer.textScore(doc, missing)).isEqualTo(0.0);
            assertThat(scorer.calculateScore(doc, missing)).isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("Total is clamped to 100")
    void clampedTotal() {
        final ScoringWeights heavy = new ScoringWeights(80, 15, 25, 10, 50, 1);
        final IndexedDocument doc = document("JS", "", List.of("a", "b"), null);

        assertThat(scorer.calculateScore(doc, SearchQuery.builder().tags("a", "b").build(), heavy)).isEqualTo(100.0);
    }

    @Test
    @DisplayName("No match and no date scores zero")
    void noMatch() {
        final IndexedDocument doc = document("Gardening", "Tomatoes and basil", List.of("garden"), null);

        assertThat(scorer.calculateScore(doc, SearchQuery.builder().title("kubernetes").build())).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Negative weights are rejected")
    void negativeWeights() {
        assertThatThrownBy(() -> new ScoringWeights(-1, 15, 25, 10, 50, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Occurrences do not overlap")
    void countOccurrences() {
        assertThat(RelevanceScorer.countOccurrences("aaaa", "aa")).isEqualTo(2);
        assertThat(RelevanceScorer.countOccurrences("abc", "")).isEqualTo(0);
    }
}
