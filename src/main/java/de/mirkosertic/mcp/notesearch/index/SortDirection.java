package de.mirkosertic.mcp.notesearch.index;

public enum SortDirection {
    ASC,
    DESC
}
