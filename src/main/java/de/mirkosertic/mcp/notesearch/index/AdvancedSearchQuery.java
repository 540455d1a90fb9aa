package de.mirkosertic.mcp.notesearch.index;

import de.mirkosertic.mcp.notesearch.query.ParsedQuery;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Query for {@link SearchEngine#advancedSearch}. The basic filters and pagination of {@link #base()} always
 * apply; scoring uses {@link #parsedQuery()}, else {@link #rawQuery()}, else {@link #similarTo()}, else falls
 * back to the flat fields of the base query.
 *
 * @param base               flat criteria, filters and pagination
 * @param rawQuery           boolean query text, see {@link de.mirkosertic.mcp.notesearch.query.QueryParser}
 * @param parsedQuery        prebuilt query, takes precedence over {@code rawQuery}
 * @param fuzzyTolerance     minimum similarity for fuzzy clauses parsed from {@code rawQuery}
 * @param sortBy             ordering, relevance when empty
 * @param similarTo          path of a reference document to find similar notes for
 * @param includeSuggestions add completions and corrections for {@code rawQuery}
 */
public record AdvancedSearchQuery(
        SearchQuery base,
        @Nullable String rawQuery,
        @Nullable ParsedQuery parsedQuery,
        @Nullable Double fuzzyTolerance,
        List<SortCriterion> sortBy,
        @Nullable String similarTo,
        boolean includeSuggestions
) {

    public AdvancedSearchQuery {
        Objects.requireNonNull(base, "base");
        sortBy = sortBy != null ? List.copyOf(sortBy) : List.of();
    }

    public static AdvancedSearchQuery ofRawQuery(final String rawQuery) {
        return new AdvancedSearchQuery(SearchQuery.builder().build(), rawQuery, null, null, List.of(), null, false);
    }

    public boolean hasRawQuery() {
        return rawQuery != null && !rawQuery.isBlank();
    }

    public boolean hasSimilarTo() {
        return similarTo != null && !similarTo.isBlank();
    }
}
