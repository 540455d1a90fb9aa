package de.mirkosertic.mcp.notesearch.index;

import java.util.Map;

/**
 * Size of the index and document count per category. Every category is present, possibly with 0.
 */
public record IndexStats(int documentCount, Map<Category, Integer> categories) {

    public IndexStats {
        categories = Map.copyOf(categories);
    }
}
