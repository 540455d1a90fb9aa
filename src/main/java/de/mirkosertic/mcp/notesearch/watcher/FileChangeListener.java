package de.mirkosertic.mcp.notesearch.watcher;

import java.nio.file.Path;

/**
 * Receives note file changes seen by {@link NoteFileWatcher}. Paths are absolute.
 */
public interface FileChangeListener {

    void onFileCreated(Path file);

    void onFileModified(Path file);

    void onFileDeleted(Path file);

    /**
     * A watched directory was deleted or moved away, together with everything below it.
     */
    void onDirectoryDeleted(Path directory);
}
