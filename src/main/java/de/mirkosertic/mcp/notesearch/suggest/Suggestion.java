package de.mirkosertic.mcp.notesearch.suggest;

/**
 * A completion or spelling correction.
 *
 * @param text          suggested query text, lowercase
 * @param type          origin of the suggestion
 * @param score         ranking score, higher is better
 * @param documentCount number of documents the text was indexed from, 0 for corrections
 */
public record Suggestion(String text, SuggestionType type, int score, int documentCount) {
}
