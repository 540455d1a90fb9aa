package de.mirkosertic.mcp.notesearch.mcp.dto;

import de.mirkosertic.mcp.notesearch.facet.FacetType;
import de.mirkosertic.mcp.notesearch.index.Category;
import de.mirkosertic.mcp.notesearch.index.Operator;
import de.mirkosertic.mcp.notesearch.index.SearchOptions;
import de.mirkosertic.mcp.notesearch.index.SearchQuery;
import de.mirkosertic.mcp.notesearch.index.SearchSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SearchRequest Tests")
class SearchRequestTest {

    @Test
    @DisplayName("Arguments map onto the query")
    void fromMap() {
        // Given
        final Map<String, Object> args = new HashMap<>();
        args.put("tags", List.of("react"));
        args.put("title", "website");
        args.put("category", "projects");
        args.put("startDate", "2024-01-01");
        args.put("operator", "OR");
        args.put("limit", 5);
        args.put("offset", "10");

        // When
        final SearchQuery query = SearchRequest.fromMap(args).toSearchQuery();

        // Then
        assertThat(query.tags()).containsExactly("react");
        assertThat(query.title()).isEqualTo("website");
        assertThat(query.content()).isNull();
        assertThat(query.category()).isEqualTo(Category.PROJECTS);
        assertThat(query.dateRange()).isNotNull();
        assertThat(query.dateRange().start()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(query.dateRange().end()).isNull();
        assertThat(query.operator()).isEqualTo(Operator.OR);
        assertThat(query.limit()).isEqualTo(5);
        assertThat(query.offset()).isEqualTo(10);
    }

    @Test
    @DisplayName("Empty arguments give an empty query")
    void emptyArguments() {
        final SearchQuery query = SearchRequest.fromMap(Map.of()).toSearchQuery();

        assertThat(query.hasCriteria()).isFalse();
        assertThat(query.operator()).isNull();
    }

    @Test
    @DisplayName("Unknown operators and facets are rejected")
    void invalidValues() {
        assertThatThrownBy(() -> SearchRequest.fromMap(Map.of("operator", "xor")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("operator");
        assertThatThrownBy(() -> SearchRequest.facetTypes(List.of("category", "colour")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("colour");
    }

    @Test
    @DisplayName("Options carry snippets and facets")
    void options() {
        final SearchRequest request = SearchRequest.fromMap(Map.of(
                "includeSnippets", true,
                "facets", List.of("dateRange", "TAGS")));

        final SearchOptions options = request.toSearchOptions(SearchSettings.DEFAULTS.defaultOptions());

        assertThat(options.includeSnippets()).isTrue();
        assertThat(options.facets()).containsExactly(FacetType.DATE_RANGE, FacetType.TAGS);
        assertThat(options.snippetLength()).isEqualTo(SearchSettings.DEFAULTS.snippetLength());
    }
}
