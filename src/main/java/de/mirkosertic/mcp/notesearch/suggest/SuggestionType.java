package de.mirkosertic.mcp.notesearch.suggest;

import java.util.Locale;

/**
 * Where a suggestion comes from.
 */
public enum SuggestionType {
    TITLE,
    TAG,
    PHRASE,
    CORRECTION;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
