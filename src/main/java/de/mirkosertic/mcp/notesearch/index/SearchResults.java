package de.mirkosertic.mcp.notesearch.index;

import de.mirkosertic.mcp.notesearch.facet.Facet;
import de.mirkosertic.mcp.notesearch.suggest.Suggestion;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of results.
 *
 * @param results         the requested page, best first
 * @param totalCount      number of matching documents before pagination
 * @param executionTimeMs wall-clock time of the search
 * @param facets          requested facets over all matching documents
 * @param suggestions     completions and corrections, advanced searches only
 * @param sortedBy        ordering that was applied
 * @param queryInfo       interpretation of a raw query, advanced searches only
 */
public record SearchResults(
        List<SearchResult> results,
        int totalCount,
        long executionTimeMs,
        List<Facet> facets,
        List<Suggestion> suggestions,
        List<SortCriterion> sortedBy,
        @Nullable QueryInfo queryInfo
) {

    public SearchResults {
        results = List.copyOf(results);
        facets = facets != null ? List.copyOf(facets) : List.of();
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
        sortedBy = sortedBy != null ? List.copyOf(sortedBy) : List.of();
    }
}
