package de.mirkosertic.mcp.notesearch.mcp.dto;

import de.mirkosertic.mcp.notesearch.index.AdvancedSearchQuery;
import de.mirkosertic.mcp.notesearch.index.SearchQuery;
import de.mirkosertic.mcp.notesearch.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for the findSimilar tool.
 */
public record FindSimilarRequest(
        @Description("Path of the reference note relative to the context root, e.g. projects/website.md")
        String path,

        @Description("Maximum number of similar notes. Default is 20.")
        @Nullable Integer limit
) {

    public static FindSimilarRequest fromMap(final Map<String, Object> args) {
        final String path = RequestValues.string(args, "path");
        return new FindSimilarRequest(path != null ? path : "", RequestValues.integer(args, "limit"));
    }

    public AdvancedSearchQuery toAdvancedSearchQuery() {
        final SearchQuery base = SearchQuery.builder().limit(limit).build();
        return new AdvancedSearchQuery(base, null, null, null, List.of(), path, false);
    }
}
