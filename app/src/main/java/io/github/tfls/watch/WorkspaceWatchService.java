package io.github.tfls.watch;

import io.github.tfls.util.ExecutorServiceUtil;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Watches every non-ignored directory below the workspace root and reports debounced batches of changed paths.
 * Directories created after start are registered as their creation events arrive.
 */
public class WorkspaceWatchService implements IWatchService {

    private final Logger logger = LogManager.getLogger(WorkspaceWatchService.class);

    private static final long DEBOUNCE_DELAY_MS = 500;
    private static final long POLL_TIMEOUT_MS = 250;

    private final Path root;
    private final Set<String> ignoredDirectories;
    private final List<Listener> listeners;

    private volatile boolean running = true;
    private volatile @Nullable Thread watcherThread;

    /**
     * Create a WorkspaceWatchService with multiple listeners.
     * All registered listeners will be notified of file system events.
     */
    public WorkspaceWatchService(Path root, Set<String> ignoredDirectories, List<Listener> listeners) {
        this.root = root.toAbsolutePath().normalize();
        this.ignoredDirectories = Set.copyOf(ignoredDirectories);
        this.listeners = new CopyOnWriteArrayList<>(listeners);
    }

    @Override
    public synchronized void start() {
        if (watcherThread != null) {
            return;
        }
        var thread = ExecutorServiceUtil.newDaemonThread(this::beginWatching, "tfls-watcher");
        watcherThread = thread;
        thread.start();
    }

    private void beginWatching() {
        logger.debug("Setting up WatchService for {}", root);
        try (WatchService watchService = FileSystems.getDefault().newWatchService()) {
            registerAllDirectories(root, watchService);

            // Watch for events, debounce them, and handle them
            while (running) {
                WatchKey key = watchService.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);

                // No event arrived within the poll window
                if (key == null) {
                    notifyNoFilesChanged();
                    continue;
                }

                // We got an event, collect it and any others within the debounce window
                var batch = new EventBatch();
                collectEventsFromKey(key, watchService, batch);

                long deadline = System.currentTimeMillis() + DEBOUNCE_DELAY_MS;
                while (true) {
                    long remaining = deadline - System.currentTimeMillis();
                    if (remaining <= 0) break;
                    WatchKey nextKey = watchService.poll(remaining, TimeUnit.MILLISECONDS);
                    if (nextKey == null) break;
                    collectEventsFromKey(nextKey, watchService, batch);
                }

                if (running) {
                    notifyFilesChanged(batch);
                }
            }
        } catch (IOException e) {
            logger.error("Error setting up watch service", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Watcher thread interrupted; shutting down");
        }
    }

    private void collectEventsFromKey(WatchKey key, WatchService watchService, EventBatch batch) {
        Path watchPath = (Path) key.watchable();
        for (WatchEvent<?> event : key.pollEvents()) {
            if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                batch.isOverflowed = true;
                continue;
            }

            // Guard: context might be null (OVERFLOW) or not a Path
            if (!(event.context() instanceof Path ctx)) {
                logger.warn("Event is not overflow but has no path: {}", event);
                continue;
            }

            Path eventPath = watchPath.resolve(ctx);
            batch.files.add(eventPath);

            // If it's a directory creation, register it so we can watch its children
            if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(eventPath)) {
                try {
                    registerAllDirectories(eventPath, watchService);
                } catch (IOException ex) {
                    logger.warn("Failed to register new directory for watching: {}", eventPath, ex);
                }
            }
        }

        // If the key is no longer valid, we can't watch this path anymore
        if (!key.reset()) {
            logger.debug("Watch key no longer valid: {}", key.watchable());
        }
    }

    private boolean isIgnored(Path dir) {
        if (dir.equals(root) || !dir.startsWith(root)) {
            return false;
        }
        for (var part : root.relativize(dir)) {
            if (ignoredDirectories.contains(part.toString())) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param start can be either the workspace root, or a newly created directory we want to add to the watch
     */
    private void registerAllDirectories(Path start, WatchService watchService) throws IOException {
        if (!Files.isDirectory(start)) return;

        for (int attempt = 1; attempt <= 3; attempt++) {
            try (var walker = Files.walk(start)) {
                walker.filter(Files::isDirectory).filter(dir -> !isIgnored(dir)).forEach(dir -> {
                    try {
                        dir.register(
                                watchService,
                                StandardWatchEventKinds.ENTRY_CREATE,
                                StandardWatchEventKinds.ENTRY_DELETE,
                                StandardWatchEventKinds.ENTRY_MODIFY);
                    } catch (IOException e) {
                        logger.warn("Failed to register directory for watching: {}", dir, e);
                    }
                });
                return;
            } catch (IOException | UncheckedIOException e) {
                Throwable cause = (e instanceof UncheckedIOException uioe) ? uioe.getCause() : e;

                // Retry only if it's a NoSuchFileException and we have attempts left.
                if (cause instanceof NoSuchFileException && attempt < 3) {
                    logger.debug("Attempt {} to walk {} raced with a deletion; retrying", attempt, start);
                    try {
                        Thread.sleep(10);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                } else {
                    logger.warn("Unable to register {} for watching: {}", start, cause.toString());
                    return;
                }
            }
        }
        logger.debug("Failed to (completely) register directory `{}` for watching", start);
    }

    @Override
    public void addListener(Listener listener) {
        listeners.add(listener);
        logger.debug("Added listener: {}", listener.getClass().getSimpleName());
    }

    @Override
    public void removeListener(Listener listener) {
        listeners.remove(listener);
        logger.debug("Removed listener: {}", listener.getClass().getSimpleName());
    }

    @Override
    public synchronized void close() {
        running = false;
        var thread = watcherThread;
        if (thread != null) {
            thread.interrupt();
        }
    }

    private void notifyFilesChanged(EventBatch batch) {
        logger.trace("Notifying {} listeners of {}", listeners.size(), batch);
        for (Listener listener : listeners) {
            try {
                listener.onFilesChanged(batch);
            } catch (Exception e) {
                logger.error(
                        "Error notifying listener {} of file changes",
                        listener.getClass().getSimpleName(),
                        e);
            }
        }
    }

    private void notifyNoFilesChanged() {
        for (Listener listener : listeners) {
            try {
                listener.onNoFilesChangedDuringPollInterval();
            } catch (Exception e) {
                logger.error(
                        "Error notifying listener {} of no file changes",
                        listener.getClass().getSimpleName(),
                        e);
            }
        }
    }
}
