package de.mirkosertic.mcp.notesearch.mcp.dto;

import de.mirkosertic.mcp.notesearch.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the suggest tool.
 */
public record SuggestRequest(
        @Description("What the user typed so far.")
        String prefix,

        @Description("Maximum number of suggestions. Default is 10.")
        @Nullable Integer limit
) {

    public static SuggestRequest fromMap(final Map<String, Object> args) {
        final String prefix = RequestValues.string(args, "prefix");
        return new SuggestRequest(prefix != null ? prefix : "", RequestValues.integer(args, "limit"));
    }

    public int effectiveLimit(final int defaultLimit) {
        return limit != null && limit > 0 ? limit : defaultLimit;
    }
}
