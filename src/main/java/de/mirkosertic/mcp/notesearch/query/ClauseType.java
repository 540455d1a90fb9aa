package de.mirkosertic.mcp.notesearch.query;

import java.util.Locale;

public enum ClauseType {

    EXACT,
    FUZZY,
    PHRASE,
    WILDCARD,
    REGEX;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
