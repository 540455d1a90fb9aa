package de.mirkosertic.mcp.notesearch.facet;

import java.util.List;

/**
 * One aggregation dimension over a document set.
 *
 * @param totalCount sum of the counts of {@link #values()}
 */
public record Facet(FacetType field, List<FacetValue> values, int totalCount) {

    public Facet {
        values = List.copyOf(values);
    }
}
