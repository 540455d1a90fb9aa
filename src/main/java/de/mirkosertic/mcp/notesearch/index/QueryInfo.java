package de.mirkosertic.mcp.notesearch.index;

import org.jspecify.annotations.Nullable;

/**
 * How a raw query was interpreted.
 *
 * @param normalizedQuery the parsed query rendered back to query syntax
 */
public record QueryInfo(boolean usedAdvancedSyntax, @Nullable String normalizedQuery) {
}
