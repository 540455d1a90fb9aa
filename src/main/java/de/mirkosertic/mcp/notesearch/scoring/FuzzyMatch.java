package de.mirkosertic.mcp.notesearch.scoring;

/**
 * A candidate returned by {@link FuzzyMatcher#findBestMatches} together with its similarity.
 */
public record FuzzyMatch(String value, double similarity) {
}
