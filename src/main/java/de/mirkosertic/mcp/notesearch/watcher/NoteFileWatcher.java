package de.mirkosertic.mcp.notesearch.watcher;

import de.mirkosertic.mcp.notesearch.store.FilePatternMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Watches the context root recursively and forwards changes of note files to a {@link FileChangeListener}.
 *
 * <p>Events are handled on a single daemon thread. Directories created or moved in while watching are registered
 * on the fly and the notes already inside them are reported as created. Excluded directories are never
 * registered. Removing a watched directory is reported once for the whole subtree. A failure while handling one
 * event is logged and the loop continues.</p>
 */
public class NoteFileWatcher implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(NoteFileWatcher.class);

    private final Path root;
    private final FilePatternMatcher patternMatcher;
    private final FileChangeListener listener;
    private final long pollIntervalMs;
    private final Map<WatchKey, Path> watchKeys = new ConcurrentHashMap<>();
    // kept when watch keys are invalidated, deletions are matched by path
    private final Set<Path> directories = ConcurrentHashMap.newKeySet();

    private volatile WatchService watchService;
    private volatile Thread watchThread;

    public NoteFileWatcher(final Path root, final FilePatternMatcher patternMatcher,
                           final FileChangeListener listener, final long pollIntervalMs) {
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be positive, was " + pollIntervalMs);
        }
        this.root = root.toAbsolutePath().normalize();
        this.patternMatcher = patternMatcher;
        this.listener = listener;
        this.pollIntervalMs = pollIntervalMs;
    }

    public synchronized void start() throws IOException {
        if (watchThread != null) {
            return;
        }
        watchService = FileSystems.getDefault().newWatchService();
        registerRecursive(root, false);

        final Thread thread = new Thread(this::processEvents, "note-file-watcher");
        thread.setDaemon(true);
        watchThread = thread;
        thread.start();
    }

    public boolean isRunning() {
        final Thread thread = watchThread;
        return thread != null && thread.isAlive();
    }

    int getWatchedDirectoryCount() {
        return watchKeys.size();
    }

    private void registerRecursive(final Path directory, final boolean reportFiles) throws IOException {
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs)
                    throws IOException {
                if (!dir.equals(root) && patternMatcher.isExcluded(dir)) {
                    logger.debug("Skipping excluded directory {}", dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                final WatchKey key = dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
                watchKeys.put(key, dir);
                directories.add(dir);
                logger.debug("Registered watch for directory: {}", dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                if (reportFiles && attrs.isRegularFile() && patternMatcher.shouldInclude(file)) {
                    listener.onFileCreated(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void forgetDirectory(final Path directory) {
        directories.removeIf(path -> path.startsWith(directory));
        watchKeys.entrySet().removeIf(entry -> {
            if (entry.getValue().startsWith(directory)) {
                entry.getKey().cancel();
                return true;
            }
            return false;
        });
    }

    private void processEvents() {
        logger.info("Watching {} for note changes", root);

        while (!Thread.currentThread().isInterrupted()) {
            final WatchKey key;
            try {
                key = watchService.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
                if (key == null) {
                    continue;
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (final ClosedWatchServiceException e) {
                logger.info("Watch service closed");
                break;
            }

            final Path directory = watchKeys.get(key);
            if (directory == null) {
                logger.warn("Watch key not recognized");
                key.reset();
                continue;
            }

            for (final WatchEvent<?> event : key.pollEvents()) {
                final WatchEvent.Kind<?> kind = event.kind();
                if (kind == OVERFLOW) {
                    logger.warn("Watch event overflow in {}, some changes may be missed", directory);
                    continue;
                }

                @SuppressWarnings("unchecked") final WatchEvent<Path> pathEvent = (WatchEvent<Path>) event;
                final Path fullPath = directory.resolve(pathEvent.context());
                try {
                    dispatch(kind, fullPath);
                } catch (final Exception e) {
                    logger.error("Error processing watch event for: {}", fullPath, e);
                }
            }

            if (!key.reset()) {
                watchKeys.remove(key);
                logger.debug("Watch key for {} no longer valid", directory);
            }
        }

        logger.info("Note file watcher stopped");
    }

    void dispatch(final WatchEvent.Kind<?> kind, final Path fullPath) throws IOException {
        if (kind == ENTRY_CREATE) {
            if (Files.isDirectory(fullPath)) {
                if (!patternMatcher.isExcluded(fullPath)) {
                    registerRecursive(fullPath, true);
                }
            } else if (Files.isRegularFile(fullPath) && patternMatcher.shouldInclude(fullPath)) {
                listener.onFileCreated(fullPath);
            }
        } else if (kind == ENTRY_MODIFY) {
            if (Files.isRegularFile(fullPath) && patternMatcher.shouldInclude(fullPath)) {
                listener.onFileModified(fullPath);
            }
        } else if (kind == ENTRY_DELETE) {
            if (directories.contains(fullPath)) {
                forgetDirectory(fullPath);
                listener.onDirectoryDeleted(fullPath);
            } else if (patternMatcher.shouldInclude(fullPath)) {
                // the file is gone, so only the name can be checked
                listener.onFileDeleted(fullPath);
            }
        }
    }

    @Override
    public synchronized void close() {
        final Thread thread = watchThread;
        if (thread == null) {
            return;
        }
        logger.info("Stopping note file watcher");
        thread.interrupt();
        try {
            watchService.close();
        } catch (final IOException e) {
            logger.error("Error closing watch service", e);
        }
        watchKeys.clear();
        directories.clear();
        watchThread = null;
    }
}
