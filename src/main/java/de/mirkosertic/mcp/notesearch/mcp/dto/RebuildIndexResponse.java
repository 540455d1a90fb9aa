package de.mirkosertic.mcp.notesearch.mcp.dto;

import org.jspecify.annotations.Nullable;

/**
 * Response DTO for the rebuildIndex tool.
 */
public record RebuildIndexResponse(
        boolean success,
        int documentCount,
        long durationMs,
        @Nullable String error
) {

    public static RebuildIndexResponse success(final int documentCount, final long durationMs) {
        return new RebuildIndexResponse(true, documentCount, durationMs, null);
    }

    public static RebuildIndexResponse error(final String errorMessage) {
        return new RebuildIndexResponse(false, 0, 0, errorMessage);
    }
}
