package de.mirkosertic.mcp.notesearch.mcp.dto;

import de.mirkosertic.mcp.notesearch.index.IndexedDocument;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Response DTO for the getDocument tool.
 */
public record GetDocumentResponse(
        boolean success,
        @Nullable String path,
        @Nullable String title,
        @Nullable String content,
        @Nullable List<String> tags,
        @Nullable String category,
        @Nullable String created,
        @Nullable String modified,
        long size,
        int wordCount,
        @Nullable String error
) {

    public static GetDocumentResponse success(final IndexedDocument document) {
        return new GetDocumentResponse(
                true,
                document.path(),
                document.title(),
                document.content(),
                List.copyOf(document.tags()),
                document.category().label(),
                RequestValues.iso(document.created()),
                RequestValues.iso(document.modified()),
                document.size(),
                document.wordCount(),
                null);
    }

    public static GetDocumentResponse error(final String errorMessage) {
        return new GetDocumentResponse(false, null, null, null, null, null, null, null, 0, 0, errorMessage);
    }
}
