package de.mirkosertic.mcp.notesearch.index;

import de.mirkosertic.mcp.notesearch.facet.FacetType;
import de.mirkosertic.mcp.notesearch.scoring.SnippetGenerator;

import java.util.List;

/**
 * Presentation options of a search, independent of the matching criteria.
 *
 * @param includeSnippets attach a highlighted excerpt to each result
 * @param snippetLength   maximum snippet length in characters
 * @param snippetContext  words of context on each side of the match
 * @param facets          facets to compute over all matching documents
 */
public record SearchOptions(boolean includeSnippets, int snippetLength, int snippetContext, List<FacetType> facets) {

    public static final SearchOptions DEFAULTS = new SearchOptions(false, SnippetGenerator.DEFAULT_MAX_LENGTH,
            SnippetGenerator.DEFAULT_CONTEXT_WORDS, List.of());

    public SearchOptions {
        if (snippetLength <= 0) {
            throw new IllegalArgumentException("snippetLength must be positive, was " + snippetLength);
        }
        if (snippetContext < 0) {
            throw new IllegalArgumentException("snippetContext must not be negative, was " + snippetContext);
        }
        facets = facets != null ? List.copyOf(facets) : List.of();
    }

    public SearchOptions withSnippets(final boolean includeSnippets) {
        return new SearchOptions(includeSnippets, snippetLength, snippetContext, facets);
    }

    public SearchOptions withFacets(final List<FacetType> facets) {
        return new SearchOptions(includeSnippets, snippetLength, snippetContext, facets);
    }
}
