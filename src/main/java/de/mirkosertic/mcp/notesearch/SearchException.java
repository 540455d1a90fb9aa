package de.mirkosertic.mcp.notesearch;

/**
 * Raised when a search request cannot be executed. The {@link #getKind() kind} is stable and
 * may be inspected by callers, the message is meant for humans.
 */
public class SearchException extends Exception {

    private final SearchErrorKind kind;

    public SearchException(final SearchErrorKind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public SearchException(final SearchErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public SearchErrorKind getKind() {
        return kind;
    }
}
