package de.mirkosertic.mcp.notesearch.index;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Document facts attached to every {@link SearchResult}.
 *
 * @param size      content length in characters
 * @param wordCount whitespace separated words in the content
 */
public record ResultMetadata(@Nullable Instant created, @Nullable Instant modified, long size, int wordCount) {

    public static ResultMetadata of(final IndexedDocument document) {
        return new ResultMetadata(document.created(), document.modified(), document.size(), document.wordCount());
    }
}
