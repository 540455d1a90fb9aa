package de.mirkosertic.mcp.notesearch.mcp.dto;

import de.mirkosertic.mcp.notesearch.index.AdvancedSearchQuery;
import de.mirkosertic.mcp.notesearch.index.Operator;
import de.mirkosertic.mcp.notesearch.index.SearchOptions;
import de.mirkosertic.mcp.notesearch.index.SearchQuery;
import de.mirkosertic.mcp.notesearch.index.SortCriterion;
import de.mirkosertic.mcp.notesearch.index.SortDirection;
import de.mirkosertic.mcp.notesearch.index.SortField;
import de.mirkosertic.mcp.notesearch.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Request DTO for the advancedSearch tool.
 */
public record AdvancedSearchRequest(
        @Description("""
                Boolean query. Terms are fuzzy by default and tolerate typos. Syntax: -term (excluded), \
                "exact phrase", title:/content:/tags: field prefixes, wildcards (proj*, te?t), \
                AND, OR, NOT (uppercase) and parentheses. Plain terms are combined with AND.""")
        @Nullable String rawQuery,

        @Description("Minimum similarity (0..1) a fuzzy term needs to match a word. Default is 0.8.")
        @Nullable Double fuzzyTolerance,

        @Description("Sort keys applied in order. Default is relevance, descending.")
        @Nullable List<SortKey> sortBy,

        @Description("Facets to compute over all matches: category, tags, dateRange, year, month.")
        @Nullable List<String> facets,

        @Description("Path of a note. Returns notes similar to it by title, tags and content keywords.")
        @Nullable String similarTo,

        @Description("Add query completions and spelling corrections for rawQuery.")
        @Nullable Boolean includeSuggestions,

        @Description("Restrict to one PARA category: projects, areas, resources or archives.")
        @Nullable String category,

        @Description("Only notes modified (or created) at or after this ISO-8601 date or timestamp.")
        @Nullable String startDate,

        @Description("Only notes modified (or created) at or before this ISO-8601 date or timestamp.")
        @Nullable String endDate,

        @Description("How the category and date filters combine: and (default) or or.")
        @Nullable Operator operator,

        @Description("Maximum number of results. Default is 20, maximum is 100.")
        @Nullable Integer limit,

        @Description("Number of results to skip. Default is 0.")
        @Nullable Integer offset,

        @Description("Attach a text excerpt around the first match to each result.")
        @Nullable Boolean includeSnippets
) {

    /**
     * One sort key.
     */
    public record SortKey(
            @Description("relevance, title, created, modified or size")
            SortField field,

            @Description("asc or desc. Default is desc.")
            @Nullable SortDirection direction
    ) {
        static SortKey fromMap(final Map<?, ?> args) {
            final Object field = args.get("field");
            if (field == null) {
                throw new IllegalArgumentException("sortBy entries need a field");
            }
            final Object direction = args.get("direction");
            return new SortKey(
                    enumValue(SortField.class, "sortBy.field", field.toString()),
                    direction != null ? enumValue(SortDirection.class, "sortBy.direction", direction.toString()) : null);
        }
    }

    public static AdvancedSearchRequest fromMap(final Map<String, Object> args) {
        final List<SortKey> sortBy;
        if (args.get("sortBy") instanceof List<?> rawSortBy) {
            sortBy = new ArrayList<>(rawSortBy.size());
            for (final Object item : rawSortBy) {
                if (item instanceof Map<?, ?> sortMap) {
                    sortBy.add(SortKey.fromMap(sortMap));
                }
            }
        } else {
            sortBy = null;
        }

        return new AdvancedSearchRequest(
                RequestValues.string(args, "rawQuery"),
                RequestValues.decimal(args, "fuzzyTolerance"),
                sortBy,
                RequestValues.strings(args, "facets"),
                RequestValues.string(args, "similarTo"),
                RequestValues.bool(args, "includeSuggestions"),
                RequestValues.string(args, "category"),
                RequestValues.string(args, "startDate"),
                RequestValues.string(args, "endDate"),
                SearchRequest.operator(RequestValues.string(args, "operator")),
                RequestValues.integer(args, "limit"),
                RequestValues.integer(args, "offset"),
                RequestValues.bool(args, "includeSnippets")
        );
    }

    private static <E extends Enum<E>> E enumValue(final Class<E> type, final String key, final String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + key + " '" + value + "'", e);
        }
    }

    /**
     * @throws IllegalArgumentException for an unknown category or an unparseable date
     */
    public AdvancedSearchQuery toAdvancedSearchQuery() {
        final SearchQuery base = SearchQuery.builder()
                .category(RequestValues.category(category))
                .dateRange(RequestValues.dateRange(startDate, endDate))
                .operator(operator)
                .limit(limit)
                .offset(offset)
                .build();

        final List<SortCriterion> criteria = new ArrayList<>();
        if (sortBy != null) {
            for (final SortKey key : sortBy) {
                criteria.add(new SortCriterion(key.field(), key.direction()));
            }
        }

        return new AdvancedSearchQuery(base, rawQuery, null, fuzzyTolerance, criteria, similarTo,
                includeSuggestions != null && includeSuggestions);
    }

    public SearchOptions toSearchOptions(final SearchOptions defaults) {
        return defaults
                .withSnippets(includeSnippets != null && includeSnippets)
                .withFacets(SearchRequest.facetTypes(facets));
    }
}
