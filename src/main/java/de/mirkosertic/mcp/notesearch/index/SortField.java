package de.mirkosertic.mcp.notesearch.index;

public enum SortField {
    RELEVANCE,
    TITLE,
    CREATED,
    MODIFIED,
    SIZE
}
