package de.mirkosertic.mcp.notesearch.suggest;

import de.mirkosertic.mcp.notesearch.index.Category;
import de.mirkosertic.mcp.notesearch.index.IndexedDocument;
import de.mirkosertic.mcp.notesearch.scoring.FuzzyMatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("SearchSuggester Tests")
class SearchSuggesterTest {

    private static final List<IndexedDocument> DOCUMENTS = List.of(
            IndexedDocument.of("resources/guide.md", "Project Planning Guide",
                    "Project planning helps teams deliver. Planning sessions happen weekly.",
                    List.of("planning", "project"), Category.RESOURCES, null, null),
            IndexedDocument.of("areas/weekly.md", "Weekly Planning", "weekly review notes",
                    List.of("Planning"), Category.AREAS, null, null));

    private final SearchSuggester suggester = new SearchSuggester(DOCUMENTS, new FuzzyMatcher());

    @Nested
    @DisplayName("Completions")
    class Completions {

        @Test
        @DisplayName("Titles, tags and phrases complete a prefix")
        void completesPrefix() {
            // When
            final List<Suggestion> suggestions = suggester.getSuggestions("plan", 6);

            // Then
            assertThat(suggestions).hasSizeLessThanOrEqualTo(6);
            assertThat(suggestions.get(0).text()).isEqualTo("planning");
            assertThat(suggestions)
                    .extracting(Suggestion::text, Suggestion::type, Suggestion::score, Suggestion::documentCount)
                    .contains(
                            tuple("planning", SuggestionType.TITLE, 72, 2),
                            tuple("planning", SuggestionType.TAG, 72, 2));
            assertThat(suggestions)
                    .filteredOn(suggestion -> suggestion.type() == SuggestionType.PHRASE)
                    .isNotEmpty()
                    .allSatisfy(suggestion -> assertThat(suggestion.text()).startsWith("planning "));
        }

        @Test
        @DisplayName("Suggestions are ordered by score")
        void ordered() {
            final List<Suggestion> suggestions = suggester.getSuggestions("p", 9);

            assertThat(suggestions).extracting(Suggestion::score).isSortedAccordingTo((a, b) -> b - a);
        }

        @Test
        @DisplayName("Prefix is matched ignoring case and surrounding whitespace")
        void normalizedPrefix() {
            assertThat(suggester.getSuggestions("  PLAN ", 6)).extracting(Suggestion::text).contains("planning");
        }

        @Test
        @DisplayName("Blank prefix or no room gives nothing")
        void blankPrefix() {
            assertThat(suggester.getSuggestions("", 5)).isEmpty();
            assertThat(suggester.getSuggestions(null, 5)).isEmpty();
            assertThat(suggester.getSuggestions("plan", 0)).isEmpty();
        }

        @Test
        @DisplayName("Repeated words in one document count once per document")
        void documentCount() {
            final SearchSuggester single = new SearchSuggester(List.of(
                    IndexedDocument.of("a.md", "Planning Planning", "", List.of(), Category.RESOURCES, null, null)),
                    new FuzzyMatcher());

            final Suggestion suggestion = single.getSuggestions("planning", 3, false).get(0);

            assertThat(suggestion.text()).isEqualTo("planning");
            assertThat(suggestion.documentCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Completion score rewards frequency, closeness and a true prefix")
        void completionScore() {
            assertThat(SearchSuggester.completionScore("planning", "plan", 2)).isEqualTo(72);
            assertThat(SearchSuggester.completionScore("planning", "plan", 9)).isEqualTo(92);
            assertThat(SearchSuggester.completionScore("plan", "planning", 1)).isEqualTo(32);
        }
    }

    @Nested
    @DisplayName("Corrections")
    class Corrections {

        @Test
        @DisplayName("Misspelled words are corrected from titles and tags")
        void correctsTypo() {
            final List<Suggestion> suggestions = suggester.getSuggestions("plannig", 6);

            assertThat(suggestions)
                    .extracting(Suggestion::text, Suggestion::type, Suggestion::score)
                    .containsExactly(tuple("planning", SuggestionType.CORRECTION, 88));
        }

        @Test
        @DisplayName("Corrections can be switched off")
        void withoutCorrections() {
            assertThat(suggester.getSuggestions("plannig", 6, false)).isEmpty();
        }

        @Test
        @DisplayName("Nothing close enough gives nothing")
        void nothingClose() {
            assertThat(suggester.getSuggestions("xylophone", 6)).isEmpty();
        }
    }

    @Test
    @DisplayName("Popular searches weight tags above title words")
    void popularSearches() {
        assertThat(suggester.getPopularSearches(3))
                .extracting(Suggestion::text, Suggestion::type, Suggestion::score)
                .containsExactly(
                        tuple("planning", SuggestionType.TAG, 30),
                        tuple("planning", SuggestionType.TITLE, 20),
                        tuple("project", SuggestionType.TAG, 15));
        assertThat(suggester.getPopularSearches(0)).isEmpty();
    }
}
