package de.mirkosertic.mcp.notesearch.query;

import org.jspecify.annotations.Nullable;

/**
 * Field a clause may be restricted to with {@code field:value} syntax.
 */
public enum QueryField {

    TITLE("title"),
    CONTENT("content"),
    TAGS("tags"),
    TAG("tag");

    private final String key;

    QueryField(final String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * {@code tags} and {@code tag} both address the tag set.
     */
    public boolean isTagField() {
        return this == TAGS || this == TAG;
    }

    /**
     * Field names are lowercase, {@code Title} is not a field.
     */
    public static @Nullable QueryField fromName(final @Nullable String name) {
        if (name == null) {
            return null;
        }
        for (final QueryField field : values()) {
            if (field.key.equals(name)) {
                return field;
            }
        }
        return null;
    }
}
