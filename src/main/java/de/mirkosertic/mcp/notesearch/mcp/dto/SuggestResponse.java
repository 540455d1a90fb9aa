package de.mirkosertic.mcp.notesearch.mcp.dto;

import de.mirkosertic.mcp.notesearch.suggest.Suggestion;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Response DTO for the suggest and popularSearches tools.
 */
public record SuggestResponse(
        boolean success,
        @Nullable List<SuggestionEntry> suggestions,
        @Nullable String error
) {

    public record SuggestionEntry(String text, String type, int score, int documentCount) {
        static SuggestionEntry of(final Suggestion suggestion) {
            return new SuggestionEntry(suggestion.text(), suggestion.type().key(), suggestion.score(),
                    suggestion.documentCount());
        }
    }

    public static SuggestResponse success(final List<Suggestion> suggestions) {
        return new SuggestResponse(true, suggestions.stream().map(SuggestionEntry::of).toList(), null);
    }

    public static SuggestResponse error(final String errorMessage) {
        return new SuggestResponse(false, null, errorMessage);
    }
}
