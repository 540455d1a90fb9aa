package de.mirkosertic.mcp.notesearch.store;

import de.mirkosertic.mcp.notesearch.index.IndexedDocument;

import java.io.IOException;
import java.util.List;

/**
 * Source of the documents the search index is built from.
 *
 * <p>Paths are relative to the store root and use {@code /} as separator.</p>
 */
public interface DocumentStore {

    /**
     * Enumerates the paths of all documents.
     */
    List<String> list() throws IOException;

    /**
     * Reads and parses a single document.
     *
     * @throws java.nio.file.NoSuchFileException if the path does not exist
     * @throws DocumentParseException           if the document cannot be parsed
     */
    IndexedDocument read(String path) throws IOException;
}
