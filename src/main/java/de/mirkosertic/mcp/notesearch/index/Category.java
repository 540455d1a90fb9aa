package de.mirkosertic.mcp.notesearch.index;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * The closed set of top-level PARA categories every note belongs to.
 */
public enum Category {

    PROJECTS("projects", "Projects"),
    AREAS("areas", "Areas"),
    RESOURCES("resources", "Resources"),
    ARCHIVES("archives", "Archives");

    private final String key;
    private final String label;

    Category(final String key, final String label) {
        this.key = key;
        this.label = label;
    }

    /**
     * Lowercase key, identical to the directory name below the context root.
     */
    public String key() {
        return key;
    }

    /**
     * Human readable label used in facets.
     */
    public String label() {
        return label;
    }

    /**
     * Resolves a category from its key, label or enum name, ignoring case.
     *
     * @return the category or {@code null} if the value is not recognized
     */
    public static @Nullable Category fromString(final @Nullable String value) {
        if (value == null) {
            return null;
        }
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (final Category category : values()) {
            if (category.key.equals(normalized)) {
                return category;
            }
        }
        return null;
    }
}
