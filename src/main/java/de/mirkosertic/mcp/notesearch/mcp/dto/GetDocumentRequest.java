package de.mirkosertic.mcp.notesearch.mcp.dto;

import de.mirkosertic.mcp.notesearch.mcp.Description;

import java.util.Map;

/**
 * Request DTO for the getDocument tool.
 */
public record GetDocumentRequest(
        @Description("Path of the note relative to the context root, as returned by the search tools.")
        String path
) {

    public static GetDocumentRequest fromMap(final Map<String, Object> args) {
        final String path = RequestValues.string(args, "path");
        return new GetDocumentRequest(path != null ? path : "");
    }
}
