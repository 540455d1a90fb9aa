package de.mirkosertic.mcp.notesearch.mcp.dto;

import de.mirkosertic.mcp.notesearch.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the popularSearches tool.
 */
public record PopularSearchesRequest(
        @Description("Maximum number of entries. Default is 10.")
        @Nullable Integer limit
) {

    public static PopularSearchesRequest fromMap(final Map<String, Object> args) {
        return new PopularSearchesRequest(RequestValues.integer(args, "limit"));
    }

    public int effectiveLimit(final int defaultLimit) {
        return limit != null && limit > 0 ? limit : defaultLimit;
    }
}
