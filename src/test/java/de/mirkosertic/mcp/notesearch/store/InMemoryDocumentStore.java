package de.mirkosertic.mcp.notesearch.store;

import de.mirkosertic.mcp.notesearch.index.IndexedDocument;

import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Map backed store for tests. Lists documents in insertion order.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, IndexedDocument> documents = new LinkedHashMap<>();

    public InMemoryDocumentStore(final IndexedDocument... documents) {
        for (final IndexedDocument document : documents) {
            put(document);
        }
    }

    public synchronized void put(final IndexedDocument document) {
        documents.put(document.path(), document);
    }

    public synchronized void remove(final String path) {
        documents.remove(path);
    }

    @Override
    public synchronized List<String> list() {
        return new ArrayList<>(documents.keySet());
    }

    @Override
    public synchronized IndexedDocument read(final String path) throws NoSuchFileException {
        final IndexedDocument document = documents.get(path);
        if (document == null) {
            throw new NoSuchFileException(path);
        }
        return document;
    }
}
