package de.mirkosertic.mcp.notesearch.index;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A ranked hit.
 *
 * @param relevanceScore score in {@code [0,100]}; for similarity searches the similarity scaled to that range
 * @param snippet        highlighted excerpt, only when snippets were requested
 */
public record SearchResult(
        String path,
        String title,
        double relevanceScore,
        @Nullable String snippet,
        List<String> tags,
        Category category,
        ResultMetadata metadata
) {
}
