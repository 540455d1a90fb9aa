package de.mirkosertic.mcp.notesearch.index;

import java.util.List;

/**
 * Search tuning of {@link SearchEngine}.
 *
 * @param defaultLimit        page size when a query does not set one
 * @param maxLimit            largest accepted page size
 * @param snippetLength       default snippet length in characters
 * @param snippetContext      default words of context around a snippet match
 * @param similarityThreshold minimum similarity of a document to the reference of a similarity search
 * @param maxSuggestions      default number of suggestions
 */
public record SearchSettings(int defaultLimit, int maxLimit, int snippetLength, int snippetContext,
                             double similarityThreshold, int maxSuggestions) {

    public static final SearchSettings DEFAULTS = new SearchSettings(20, 100, 150, 5, 0.3, 10);

    public SearchSettings {
        if (defaultLimit <= 0 || maxLimit < defaultLimit) {
            throw new IllegalArgumentException("Limits must satisfy 0 < defaultLimit <= maxLimit, were "
                    + defaultLimit + " and " + maxLimit);
        }
        if (snippetLength <= 0 || snippetContext < 0) {
            throw new IllegalArgumentException("Invalid snippet settings " + snippetLength + "/" + snippetContext);
        }
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be within [0,1], was " + similarityThreshold);
        }
        if (maxSuggestions <= 0) {
            throw new IllegalArgumentException("maxSuggestions must be positive, was " + maxSuggestions);
        }
    }

    /**
     * Presentation defaults derived from these settings.
     */
    public SearchOptions defaultOptions() {
        return new SearchOptions(false, snippetLength, snippetContext, List.of());
    }
}
