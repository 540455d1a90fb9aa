package de.mirkosertic.mcp.notesearch.index;

import java.util.Objects;

/**
 * One key of a multi-key result ordering.
 */
public record SortCriterion(SortField field, SortDirection direction) {

    public SortCriterion {
        Objects.requireNonNull(field, "field");
        direction = direction != null ? direction : SortDirection.DESC;
    }
}
