package de.mirkosertic.mcp.notesearch.facet;

/**
 * @param value filter value accepted by {@link FacetGenerator#applyFacetFilter}
 * @param label display text
 * @param count number of documents in this bucket
 */
public record FacetValue(String value, String label, int count) {
}
