package de.mirkosertic.mcp.notesearch.store;

import java.util.Map;

/**
 * YAML frontmatter of a markdown file and the body that follows it.
 *
 * @param properties top-level frontmatter entries, empty if the file has none
 * @param body       markdown after the closing delimiter, the whole text if there is no frontmatter
 */
public record Frontmatter(Map<String, Object> properties, String body) {

    public Frontmatter {
        properties = properties != null ? properties : Map.of();
        body = body != null ? body : "";
    }

    public boolean isPresent() {
        return !properties.isEmpty();
    }
}
