package de.mirkosertic.mcp.notesearch.index;

/**
 * How the category and date range filters of a {@link SearchQuery} combine.
 */
public enum Operator {
    AND,
    OR
}
