package de.mirkosertic.mcp.notesearch.mcp.dto;

import de.mirkosertic.mcp.notesearch.SearchErrorKind;
import de.mirkosertic.mcp.notesearch.facet.Facet;
import de.mirkosertic.mcp.notesearch.facet.FacetValue;
import de.mirkosertic.mcp.notesearch.index.QueryInfo;
import de.mirkosertic.mcp.notesearch.index.SearchResult;
import de.mirkosertic.mcp.notesearch.index.SearchResults;
import de.mirkosertic.mcp.notesearch.index.SortCriterion;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * Response DTO for the search, advancedSearch and findSimilar tools.
 */
public record SearchResponse(
        boolean success,
        @Nullable List<Hit> results,
        int totalCount,
        long executionTimeMs,
        @Nullable List<FacetEntry> facets,
        @Nullable List<SuggestResponse.SuggestionEntry> suggestions,
        @Nullable List<String> sortedBy,
        @Nullable Boolean usedAdvancedSyntax,
        @Nullable String normalizedQuery,
        @Nullable String error,
        @Nullable String errorKind
) {

    /**
     * One matching note. Dates are ISO-8601, size counts characters.
     */
    public record Hit(
            String path,
            String title,
            double relevanceScore,
            @Nullable String snippet,
            List<String> tags,
            String category,
            @Nullable String created,
            @Nullable String modified,
            long size,
            int wordCount
    ) {
        static Hit of(final SearchResult result) {
            return new Hit(
                    result.path(),
                    result.title(),
                    result.relevanceScore(),
                    result.snippet(),
                    result.tags(),
                    result.category().label(),
                    RequestValues.iso(result.metadata().created()),
                    RequestValues.iso(result.metadata().modified()),
                    result.metadata().size(),
                    result.metadata().wordCount());
        }
    }

    public record FacetEntry(String field, int totalCount, List<FacetValue> values) {
        static FacetEntry of(final Facet facet) {
            return new FacetEntry(facet.field().key(), facet.totalCount(), facet.values());
        }
    }

    public static SearchResponse success(final SearchResults results) {
        final QueryInfo queryInfo = results.queryInfo();
        return new SearchResponse(
                true,
                results.results().stream().map(Hit::of).toList(),
                results.totalCount(),
                results.executionTimeMs(),
                results.facets().isEmpty() ? null : results.facets().stream().map(FacetEntry::of).toList(),
                results.suggestions().isEmpty()
                        ? null
                        : results.suggestions().stream().map(SuggestResponse.SuggestionEntry::of).toList(),
                results.sortedBy().isEmpty() ? null : results.sortedBy().stream().map(SearchResponse::describe).toList(),
                queryInfo != null ? queryInfo.usedAdvancedSyntax() : null,
                queryInfo != null ? queryInfo.normalizedQuery() : null,
                null,
                null);
    }

    public static SearchResponse error(final String errorMessage) {
        return new SearchResponse(false, null, 0, 0, null, null, null, null, null, errorMessage, null);
    }

    public static SearchResponse error(final String errorMessage, final SearchErrorKind kind) {
        return new SearchResponse(false, null, 0, 0, null, null, null, null, null, errorMessage, kind.name());
    }

    private static String describe(final SortCriterion criterion) {
        return criterion.field().name().toLowerCase(Locale.ROOT) + " " + criterion.direction().name().toLowerCase(Locale.ROOT);
    }
}
