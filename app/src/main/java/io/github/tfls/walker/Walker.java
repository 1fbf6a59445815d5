package io.github.tfls.walker;

import io.github.tfls.indexer.ConfigFiles;
import io.github.tfls.indexer.DocumentId;
import io.github.tfls.jobs.ScopeLease;
import io.github.tfls.jobs.ScopeTracker;
import io.github.tfls.util.ExecutorServiceUtil;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.LinkedBlockingQueue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Discovers configuration files under the workspace root and under every local module root handed to
 * {@link #enqueue}. Walks run one at a time on a dedicated daemon thread.
 *
 * <p>Each queued walk holds a {@link ScopeLease} from the moment it is enqueued until it finishes, so waiting on a
 * root never returns between "walk requested" and "first file handed to the listener". A directory that is already
 * covered by a queued or finished walk is not walked again; this is also what stops module reference cycles.
 *
 * <p>Traversal is depth first over sorted listings (files before subdirectories), so discovery order is
 * deterministic. Unreadable entries are recorded in the {@link WalkerCollector} and skipped.
 */
public final class Walker implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(Walker.class);

    private record WalkRequest(Path directory, ScopeLease lease) {}

    private static final WalkRequest POISON = new WalkRequest(Path.of(""), null);

    private final Path workspaceRoot;
    private final Set<String> ignoredDirectories;
    private final ScopeTracker tracker;
    private final WalkerCollector collector;

    private final LinkedBlockingQueue<WalkRequest> queue = new LinkedBlockingQueue<>();
    // guarded by this
    private final Set<Path> coveredRoots = new LinkedHashSet<>();

    private volatile boolean running = true;
    private volatile @Nullable Thread thread;

    public Walker(Path workspaceRoot, Set<String> ignoredDirectories, ScopeTracker tracker, WalkerCollector collector) {
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        this.ignoredDirectories = Set.copyOf(ignoredDirectories);
        this.tracker = tracker;
        this.collector = collector;
    }

    public synchronized void start(DiscoveryListener listener) {
        if (thread != null) {
            throw new IllegalStateException("Walker already started");
        }
        var t = ExecutorServiceUtil.newDaemonThread(() -> drain(listener), "tfls-walker");
        thread = t;
        t.start();
    }

    /** Queue {@code directory} unless it is already covered. Returns whether a walk was queued. */
    public boolean enqueue(Path directory, Set<Path> scopes) {
        return enqueue(directory, scopes, false);
    }

    /**
     * @param force walk again even if the directory was walked before, e.g. after the file watcher lost events
     */
    public synchronized boolean enqueue(Path directory, Set<Path> scopes, boolean force) {
        if (!running) {
            logger.debug("Walker stopped; ignoring {}", directory);
            return false;
        }
        var dir = directory.toAbsolutePath().normalize();
        if (!force && coveredRoots.stream().anyMatch(dir::startsWith)) {
            logger.trace("{} is already covered by a walk", dir);
            return false;
        }
        coveredRoots.add(dir);
        var allScopes = new HashSet<>(scopes);
        allScopes.add(dir);
        queue.add(new WalkRequest(dir, tracker.acquire(allScopes)));
        logger.debug("Queued walk of {}", dir);
        return true;
    }

    public synchronized boolean isCovered(Path directory) {
        var dir = directory.toAbsolutePath().normalize();
        return coveredRoots.stream().anyMatch(dir::startsWith);
    }

    private void drain(DiscoveryListener listener) {
        while (running) {
            WalkRequest request;
            try {
                request = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.debug("Walker interrupted; stopping");
                break;
            }
            if (request == POISON) {
                break;
            }
            try {
                walk(request, listener);
            } finally {
                request.lease().close();
            }
        }
        releaseQueued();
    }

    private void walk(WalkRequest request, DiscoveryListener listener) {
        long start = System.currentTimeMillis();
        int before = collector.discoveredCount();
        if (!Files.isDirectory(request.directory())) {
            logger.warn("Cannot walk {}: not a directory", request.directory());
            collector.recordError(request.directory(), new IOException("Not a directory"));
            return;
        }
        walkDirectory(request.directory(), request, listener);
        collector.recordWalked(request.directory());
        logger.debug(
                "Walked {} in {} ms, {} files discovered",
                request.directory(),
                System.currentTimeMillis() - start,
                collector.discoveredCount() - before);
    }

    private void walkDirectory(Path dir, WalkRequest request, DiscoveryListener listener) {
        if (!running) {
            return;
        }
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            stream.forEach(entries::add);
        } catch (IOException e) {
            logger.warn("Unable to read directory {}: {}", dir, e.toString());
            collector.recordError(dir, e);
            return;
        }
        entries.sort(Comparator.comparing(p -> p.getFileName().toString()));

        var subdirectories = new ArrayList<Path>();
        for (var entry : entries) {
            var name = entry.getFileName().toString();
            if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                if (ignoredDirectories.contains(name)) {
                    logger.trace("Skipping ignored directory {}", entry);
                } else {
                    subdirectories.add(entry);
                }
                continue;
            }
            if (!ConfigFiles.isConfigFile(name)) {
                continue;
            }
            if (!Files.isReadable(entry)) {
                logger.warn("Skipping unreadable file {}", entry);
                collector.recordError(entry, new AccessDeniedException(entry.toString()));
                continue;
            }
            discover(entry, request, listener);
        }
        for (var subdirectory : subdirectories) {
            walkDirectory(subdirectory, request, listener);
        }
    }

    private void discover(Path file, WalkRequest request, DiscoveryListener listener) {
        var id = DocumentId.of(workspaceRoot, file);
        collector.recordDiscovered();
        try {
            listener.onDiscovered(id, request.lease().scopes());
        } catch (RuntimeException e) {
            logger.error("Discovery listener failed for {}", id, e);
        }
    }

    private void releaseQueued() {
        var remaining = new ArrayList<WalkRequest>();
        queue.drainTo(remaining);
        remaining.stream().filter(r -> r != POISON).forEach(r -> r.lease().close());
    }

    /** Stops the walker thread. Queued walks are abandoned and their leases released. */
    @Override
    public void close() {
        Thread t;
        synchronized (this) {
            running = false;
            t = thread;
        }
        if (t == null) {
            releaseQueued();
            return;
        }
        queue.add(POISON);
        try {
            t.join(5000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while stopping walker");
        }
        releaseQueued();
    }
}
