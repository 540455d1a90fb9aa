package de.mirkosertic.mcp.notesearch.store;

import java.io.IOException;

/**
 * A document exists but its frontmatter or metadata is malformed.
 */
public class DocumentParseException extends IOException {

    private final String path;

    public DocumentParseException(final String path, final String message) {
        super(message + " in " + path);
        this.path = path;
    }

    public DocumentParseException(final String path, final String message, final Throwable cause) {
        super(message + " in " + path, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
