package de.mirkosertic.mcp.notesearch.watcher;

import de.mirkosertic.mcp.notesearch.index.SearchEngine;
import de.mirkosertic.mcp.notesearch.store.MarkdownDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Keeps a {@link SearchEngine} in sync with the notes on disk.
 */
public class IndexUpdatingListener implements FileChangeListener {

    private static final Logger logger = LoggerFactory.getLogger(IndexUpdatingListener.class);

    private final SearchEngine searchEngine;
    private final MarkdownDocumentStore documentStore;

    public IndexUpdatingListener(final SearchEngine searchEngine, final MarkdownDocumentStore documentStore) {
        this.searchEngine = searchEngine;
        this.documentStore = documentStore;
    }

    @Override
    public void onFileCreated(final Path file) {
        update(file);
    }

    @Override
    public void onFileModified(final Path file) {
        update(file);
    }

    @Override
    public void onFileDeleted(final Path file) {
        final String path = documentStore.toRelativePath(file);
        if (searchEngine.removeDocument(path)) {
            logger.info("Removed deleted note {} from the index", path);
        }
    }

    @Override
    public void onDirectoryDeleted(final Path directory) {
        final String path = documentStore.toRelativePath(directory);
        final int removed = searchEngine.removeDocumentsUnder(path);
        if (removed > 0) {
            logger.info("Removed {} notes below deleted directory {} from the index", removed, path);
        }
    }

    private void update(final Path file) {
        final String path = documentStore.toRelativePath(file);
        if (searchEngine.updateDocument(path)) {
            logger.debug("Re-indexed note {}", path);
        }
    }
}
