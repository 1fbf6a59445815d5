package io.github.tfls;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import io.github.tfls.exception.DeadlineExceededException;
import io.github.tfls.hcl.BlockDecoder;
import io.github.tfls.hcl.DispatchingParser;
import io.github.tfls.indexer.ConfigFiles;
import io.github.tfls.indexer.Decoder;
import io.github.tfls.indexer.DocumentId;
import io.github.tfls.indexer.Parser;
import io.github.tfls.jobs.ScopeTracker;
import io.github.tfls.search.WorkspaceSymbolSearch;
import io.github.tfls.state.Document;
import io.github.tfls.state.StateStore;
import io.github.tfls.walker.Walker;
import io.github.tfls.walker.WalkerCollector;
import io.github.tfls.watch.IWatchService;
import io.github.tfls.watch.IWatchService.EventBatch;
import io.github.tfls.watch.WorkspaceWatchService;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Indexes one workspace: walks it, keeps documents and symbols current as the editor and the filesystem change them,
 * and answers workspace symbol queries.
 *
 * <pre>{@code
 * try (var service = new IndexingService(root, IndexerConfig.load(root))) {
 *     service.start();
 *     service.awaitScope(Duration.ofSeconds(30));
 *     var hits = service.search().searchWorkspaceSymbols("aws_inst");
 * }
 * }</pre>
 */
public final class IndexingService implements IWatchService.Listener, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(IndexingService.class);

    private final Path root;
    private final IndexerConfig config;
    private final ScopeTracker tracker = new ScopeTracker();
    private final WalkerCollector collector = new WalkerCollector();
    private final Walker walker;
    private final StateStore state;
    private final WorkspaceSymbolSearch search;
    // paths as plain strings; the default serializer turns a relative path into an absolute URI
    private final ObjectMapper mapper =
            new ObjectMapper().registerModule(new SimpleModule().addSerializer(Path.class, ToStringSerializer.instance));

    private @Nullable IWatchService watchService;
    private boolean started;

    public IndexingService(Path root, IndexerConfig config) {
        this(root, config, new DispatchingParser(), new BlockDecoder());
    }

    public IndexingService(Path root, IndexerConfig config, Parser parser, Decoder decoder) {
        this.root = root.toAbsolutePath().normalize();
        this.config = config;
        this.walker = new Walker(this.root, config.ignoredDirectories(), tracker, collector);
        this.state = new StateStore(config.workers(), parser, decoder, tracker, walker);
        this.search = new WorkspaceSymbolSearch(state::allSymbols);
    }

    /** Starts the walker, queues the root walk and, when enabled, starts watching the filesystem. */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("IndexingService already started for " + root);
        }
        started = true;
        logger.info("Indexing {} with {} workers", root, config.workers());
        walker.start(state::discover);
        walker.enqueue(root, Set.of(root));
        if (config.watchFiles()) {
            var watcher = new WorkspaceWatchService(root, config.ignoredDirectories(), List.of(this));
            watchService = watcher;
            watcher.start();
        }
    }

    public Path root() {
        return root;
    }

    public IndexerConfig config() {
        return config;
    }

    public StateStore state() {
        return state;
    }

    public WorkspaceSymbolSearch search() {
        return search;
    }

    public WalkerCollector collector() {
        return collector;
    }

    public DocumentId documentId(Path file) {
        return DocumentId.of(root, file);
    }

    /** Waits until everything under the workspace root is indexed. */
    public void awaitScope(Duration timeout) throws InterruptedException, DeadlineExceededException {
        state.awaitScope(root, timeout);
    }

    public void awaitScope(Path scope, Duration timeout) throws InterruptedException, DeadlineExceededException {
        state.awaitScope(scope, timeout);
    }

    public void awaitIdle(Duration timeout) throws InterruptedException, DeadlineExceededException {
        state.awaitIdle(timeout);
    }

    /** Current symbols as JSON, in canonical order. */
    public String exportSymbolsJson() {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(state.allSymbols());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void onFilesChanged(EventBatch batch) {
        logger.trace("IndexingService received events batch: {}", batch);
        if (batch.isOverflowed()) {
            logger.debug("Event batch overflowed, re-walking {}", root);
            rescan();
            return;
        }
        for (var path : batch.files()) {
            var absolute = path.toAbsolutePath().normalize();
            if (!absolute.startsWith(root) || isIgnored(absolute)) {
                continue;
            }
            if (Files.isDirectory(absolute)) {
                directoryChanged(absolute);
            } else if (Files.exists(absolute)) {
                if (ConfigFiles.isConfigFile(absolute.getFileName().toString())) {
                    state.notifyFileChanged(DocumentId.of(root, absolute));
                }
            } else {
                deleted(absolute);
            }
        }
    }

    /** Re-walks the root and drops documents whose files are gone. */
    public void rescan() {
        for (var document : state.documents()) {
            if (!document.open() && !document.id().exists()) {
                state.notifyFileDeleted(document.id());
            }
        }
        walker.enqueue(root, Set.of(root), true);
    }

    private void directoryChanged(Path dir) {
        // a directory with known documents is already indexed; its files report their own changes
        boolean known = state.documents().stream()
                .map(Document::id)
                .anyMatch(id -> id.absPath().startsWith(dir));
        if (!known) {
            logger.debug("New directory {}; walking it", dir);
            walker.enqueue(dir, Set.of(root), true);
        }
    }

    private void deleted(Path path) {
        for (var document : state.documents()) {
            var id = document.id();
            if (id.absPath().startsWith(path)) {
                state.notifyFileDeleted(id);
            }
        }
    }

    private boolean isIgnored(Path path) {
        if (path.equals(root)) {
            return false;
        }
        var relative = root.relativize(path);
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (config.ignoredDirectories().contains(relative.getName(i).toString())) {
                return true;
            }
        }
        var name = relative.getFileName().toString();
        return config.ignoredDirectories().contains(name) && Files.isDirectory(path);
    }

    @Override
    public void close() {
        var watcher = watchService;
        if (watcher != null) {
            watcher.close();
        }
        walker.close();
        state.close();
        logger.debug("IndexingService for {} closed", root);
    }
}
