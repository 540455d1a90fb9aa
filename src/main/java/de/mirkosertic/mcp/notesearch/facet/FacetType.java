package de.mirkosertic.mcp.notesearch.facet;

import org.jspecify.annotations.Nullable;

/**
 * Aggregation dimensions supported by {@link FacetGenerator}.
 */
public enum FacetType {

    CATEGORY("category"),
    TAGS("tags"),
    DATE_RANGE("dateRange"),
    YEAR("year"),
    MONTH("month");

    private final String key;

    FacetType(final String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Resolves a facet type from its key ({@code dateRange}) or enum name ({@code DATE_RANGE}), ignoring case.
     */
    public static @Nullable FacetType fromString(final @Nullable String value) {
        if (value == null) {
            return null;
        }
        final String trimmed = value.trim();
        for (final FacetType type : values()) {
            if (type.key.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        return null;
    }
}
