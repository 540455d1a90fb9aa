package de.mirkosertic.mcp.notesearch.index;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A note as held by the in-memory index.
 *
 * @param path     relative, {@code /}-separated path; unique key of the document
 * @param title    document title, never null
 * @param content  markdown body without frontmatter, never null
 * @param tags     tags in source order
 * @param category PARA category
 * @param created  creation time if known
 * @param modified last modification time if known
 */
public record IndexedDocument(
        String path,
        String title,
        String content,
        Set<String> tags,
        Category category,
        @Nullable Instant created,
        @Nullable Instant modified
) {

    public IndexedDocument {
        Objects.requireNonNull(path, "path");
        title = title != null ? title : "";
        content = content != null ? content : "";
        tags = tags != null ? Collections.unmodifiableSet(new LinkedHashSet<>(tags)) : Set.of();
        category = category != null ? category : Category.RESOURCES;
    }

    public static IndexedDocument of(final String path, final String title, final String content,
                                     final Collection<String> tags, final Category category,
                                     final @Nullable Instant created, final @Nullable Instant modified) {
        return new IndexedDocument(path, title, content, new LinkedHashSet<>(tags), category, created, modified);
    }

    /**
     * The date used for recency, date facets and date filters: {@code modified}, else {@code created}.
     */
    public @Nullable Instant effectiveDate() {
        return modified != null ? modified : created;
    }

    /**
     * Content length in characters.
     */
    public long size() {
        return content.length();
    }

    public int wordCount() {
        final String trimmed = content.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        return trimmed.split("\\s+").length;
    }
}
