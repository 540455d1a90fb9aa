package de.mirkosertic.mcp.notesearch.mcp.dto;

import de.mirkosertic.mcp.notesearch.facet.FacetType;
import de.mirkosertic.mcp.notesearch.index.Operator;
import de.mirkosertic.mcp.notesearch.index.SearchOptions;
import de.mirkosertic.mcp.notesearch.index.SearchQuery;
import de.mirkosertic.mcp.notesearch.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Request DTO for the search tool.
 */
public record SearchRequest(
        @Description("Tags the notes should carry. Exact tag matches score highest, partial matches less.")
        @Nullable List<String> tags,

        @Description("Text to look for in the note content. Phrases score per occurrence.")
        @Nullable String content,

        @Description("Text to look for in the note title.")
        @Nullable String title,

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
        @Nullable Boolean includeSnippets,

        @Description("Facets to compute over all matches: category, tags, dateRange, year, month.")
        @Nullable List<String> facets
) {

    public static SearchRequest fromMap(final Map<String, Object> args) {
        return new SearchRequest(
                RequestValues.strings(args, "tags"),
                RequestValues.string(args, "content"),
                RequestValues.string(args, "title"),
                RequestValues.string(args, "category"),
                RequestValues.string(args, "startDate"),
                RequestValues.string(args, "endDate"),
                operator(RequestValues.string(args, "operator")),
                RequestValues.integer(args, "limit"),
                RequestValues.integer(args, "offset"),
                RequestValues.bool(args, "includeSnippets"),
                RequestValues.strings(args, "facets")
        );
    }

    static @Nullable Operator operator(final @Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Operator.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("operator must be 'and' or 'or', was '" + value + "'", e);
        }
    }

    static List<FacetType> facetTypes(final @Nullable List<String> names) {
        if (names == null) {
            return List.of();
        }
        final List<FacetType> types = new ArrayList<>();
        for (final String name : names) {
            final FacetType type = FacetType.fromString(name);
            if (type == null) {
                throw new IllegalArgumentException("Unknown facet '" + name
                        + "', expected one of category, tags, dateRange, year, month");
            }
            types.add(type);
        }
        return types;
    }

    /**
     * @throws IllegalArgumentException for an unknown category or an unparseable date
     */
    public SearchQuery toSearchQuery() {
        return SearchQuery.builder()
                .tags(tags)
                .content(content)
                .title(title)
                .category(RequestValues.category(category))
                .dateRange(RequestValues.dateRange(startDate, endDate))
                .operator(operator)
                .limit(limit)
                .offset(offset)
                .build();
    }

    public SearchOptions toSearchOptions(final SearchOptions defaults) {
        return defaults
                .withSnippets(includeSnippets != null && includeSnippets)
                .withFacets(facetTypes(facets));
    }
}
