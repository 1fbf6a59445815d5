package io.github.tfls.state;

import io.github.tfls.exception.DeadlineExceededException;
import io.github.tfls.exception.IndexingException;
import io.github.tfls.indexer.DecodeResult;
import io.github.tfls.indexer.Decoder;
import io.github.tfls.indexer.DocumentId;
import io.github.tfls.indexer.ParseResult;
import io.github.tfls.indexer.Parser;
import io.github.tfls.indexer.Symbol;
import io.github.tfls.jobs.Job;
import io.github.tfls.jobs.JobContext;
import io.github.tfls.jobs.JobId;
import io.github.tfls.jobs.JobKind;
import io.github.tfls.jobs.JobPriority;
import io.github.tfls.jobs.JobScheduler;
import io.github.tfls.jobs.ScopeTracker;
import io.github.tfls.walker.Walker;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Owns every document's indexing state and turns editor and filesystem notifications into jobs.
 *
 * <p>Job bodies never hold a lock while reading files or parsing. Each one takes a {@link Document} snapshot, computes,
 * and installs the result through {@link DocumentStore#update} in a single step.
 */
public final class StateStore implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(StateStore.class);

    private final Parser parser;
    private final Decoder decoder;
    private final Walker walker;
    private final DocumentStore documents = new DocumentStore();
    private final JobScheduler scheduler;

    public StateStore(int workers, Parser parser, Decoder decoder, ScopeTracker tracker, Walker walker) {
        this.parser = parser;
        this.decoder = decoder;
        this.walker = walker;
        this.scheduler = new JobScheduler(workers, tracker, this::prerequisiteFor, this::recordFailure);
    }

    /**
     * Installs editor content for {@code id} and schedules a foreground parse. An update whose version is not newer than
     * the one already installed for an open document is ignored.
     *
     * @return false if the update was stale and ignored
     */
    public boolean openOrUpdateDocument(DocumentId id, String text, int version) {
        var stale = new boolean[1];
        documents.compute(id, current -> {
            if (current == null) {
                return Document.discovered(id).opened(text, version);
            }
            if (current.open() && version <= current.version()) {
                stale[0] = true;
                return null;
            }
            return current.opened(text, version);
        });
        if (stale[0]) {
            logger.warn("Ignoring stale update of {} at version {}", id, version);
            return false;
        }
        logger.debug("{} opened at version {}", id, version);
        scheduler.submit(parseJob(id, JobPriority.FOREGROUND, Set.of(id.absPath())));
        return true;
    }

    /** Marks the document closed. Its text and symbols stay until the file changes or disappears. */
    public void closeDocument(DocumentId id) {
        if (!documents.update(id, Document::closed)) {
            logger.debug("Close of unknown document {}", id);
        }
    }

    public void notifyFileChanged(DocumentId id) {
        var current = documents.register(id);
        if (current.open()) {
            logger.debug("{} changed on disk but is open in the editor; ignoring", id);
            return;
        }
        scheduler.submit(parseJob(id, JobPriority.BACKGROUND, Set.of(id.absPath())));
    }

    public void notifyFileDeleted(DocumentId id) {
        var current = documents.get(id);
        if (current == null) {
            logger.trace("Delete of unknown document {}", id);
            return;
        }
        if (current.open()) {
            logger.debug("{} deleted on disk but is open in the editor; ignoring", id);
            return;
        }
        scheduler.submit(Job.of(JobKind.REMOVE, id, JobPriority.BACKGROUND, ctx -> {
            // re-checked when the job runs: the file may have come back or been opened since the delete was queued
            boolean onDisk = id.exists();
            if (documents.removeIf(id, existing -> !existing.open() && !onDisk) != null) {
                logger.debug("Removed {}", id);
            } else {
                logger.debug("{} is open or back on disk; keeping it", id);
            }
        }));
    }

    /** Called by the walker for every configuration file it finds. */
    public void discover(DocumentId id, Set<Path> scopes) {
        var current = documents.register(id);
        if (current.open()) {
            logger.trace("{} discovered but already open", id);
            return;
        }
        var allScopes = new HashSet<>(scopes);
        allScopes.add(id.absPath());
        scheduler.submit(parseJob(id, JobPriority.BACKGROUND, allScopes));
    }

    /** Every symbol of every document, in canonical document order. Never waits for indexing. */
    public List<Symbol> allSymbols() {
        var result = new ArrayList<Symbol>();
        for (var document : documents.snapshot()) {
            result.addAll(document.symbols());
        }
        return result;
    }

    public Optional<Document> document(DocumentId id) {
        return Optional.ofNullable(documents.get(id));
    }

    public List<Document> documents() {
        return documents.snapshot();
    }

    public void awaitScope(Path scope, Duration timeout) throws InterruptedException, DeadlineExceededException {
        scheduler.await(scope, timeout);
    }

    public void awaitIdle(Duration timeout) throws InterruptedException, DeadlineExceededException {
        scheduler.awaitIdle(timeout);
    }

    @Override
    public void close() {
        scheduler.close();
    }

    private Job parseJob(DocumentId id, JobPriority priority, Set<Path> scopes) {
        return new Job(new JobId(JobKind.PARSE, id), priority, scopes, ctx -> parse(id, ctx));
    }

    private Job decodeSymbolsJob(DocumentId id, JobPriority priority) {
        return Job.of(JobKind.DECODE_SYMBOLS, id, priority, ctx -> decodeSymbols(id));
    }

    private Job decodeModuleCallsJob(DocumentId id, JobPriority priority) {
        return Job.of(JobKind.DECODE_MODULE_CALLS, id, priority, ctx -> decodeModuleCalls(id, ctx));
    }

    private void parse(DocumentId id, JobContext ctx) throws IOException {
        var snapshot = documents.get(id);
        if (snapshot == null) {
            logger.debug("{} is gone; skipping parse", id);
            return;
        }
        String text;
        String diskText = null;
        if (snapshot.open()) {
            text = snapshot.text();
            assert text != null;
        } else {
            diskText = id.read();
            text = diskText;
        }

        ParseResult result;
        try {
            result = parser.parse(id, text);
        } catch (RuntimeException e) {
            throw new IndexingException("parsing " + id, e);
        }

        String readFromDisk = diskText;
        var installed = documents.update(id, current -> {
            // opened while we were reading the file: the editor text wins and its own parse is queued
            if (readFromDisk != null && current.open()) {
                return current;
            }
            var next = readFromDisk != null ? current.withDiskText(readFromDisk) : current;
            return next.withParse(result);
        });
        if (!installed) {
            return;
        }
        if (result.hasErrors()) {
            logger.debug("{} parsed with {} diagnostics", id, result.diagnostics().size());
        }
        ctx.submit(decodeSymbolsJob(id, ctx.priority()));
        ctx.submit(decodeModuleCallsJob(id, ctx.priority()));
    }

    private void decodeSymbols(DocumentId id) {
        var snapshot = documents.get(id);
        if (snapshot == null || snapshot.parse() == null) {
            logger.debug("{} has no parse result; skipping symbol decode", id);
            return;
        }
        var parse = snapshot.parse();
        DecodeResult decoded;
        if (parse.hasErrors()) {
            decoded = new DecodeResult(List.of(), List.of(), parse.diagnostics());
        } else {
            try {
                decoded = decoder.decode(id, parse.tree());
            } catch (RuntimeException e) {
                throw new IndexingException("decoding " + id, e);
            }
            var diagnostics = new ArrayList<>(parse.diagnostics());
            diagnostics.addAll(decoded.diagnostics());
            decoded = new DecodeResult(decoded.symbols(), decoded.moduleCalls(), diagnostics);
        }
        var result = decoded;
        documents.update(id, current -> current.parse() == parse
                ? current.withDecoded(result.symbols(), result.moduleCalls(), result.diagnostics())
                : current);
        logger.trace("{} decoded to {} symbols", id, result.symbols().size());
    }

    private void decodeModuleCalls(DocumentId id, JobContext ctx) {
        var snapshot = documents.get(id);
        if (snapshot == null) {
            return;
        }
        for (var call : snapshot.moduleCalls()) {
            if (!call.isLocal()) {
                logger.trace("Module {} in {} has non-local source {}", call.name(), id, call.source());
                continue;
            }
            Path dir;
            try {
                dir = id.directory().resolve(call.source()).normalize();
            } catch (RuntimeException e) {
                logger.warn("Module {} in {} has unusable source {}", call.name(), id, call.source());
                continue;
            }
            if (!Files.isDirectory(dir)) {
                logger.debug("Module {} in {} points at missing directory {}", call.name(), id, dir);
                continue;
            }
            if (walker.enqueue(dir, ctx.scopes())) {
                logger.debug("Module {} in {} queued walk of {}", call.name(), id, dir);
            }
        }
    }

    private Optional<Job> prerequisiteFor(JobId prerequisite) {
        if (!documents.contains(prerequisite.target())) {
            return Optional.empty();
        }
        var target = prerequisite.target();
        return switch (prerequisite.kind()) {
            case PARSE -> Optional.of(parseJob(target, JobPriority.BACKGROUND, Set.of(target.absPath())));
            case DECODE_SYMBOLS -> Optional.of(decodeSymbolsJob(target, JobPriority.BACKGROUND));
            default -> Optional.empty();
        };
    }

    private void recordFailure(JobId id, Throwable failure) {
        var kind = id.kind();
        if (kind == JobKind.REMOVE) {
            return;
        }
        boolean clearSymbols = kind == JobKind.PARSE || kind == JobKind.DECODE_SYMBOLS;
        documents.update(id.target(), current -> current.withFailure(describe(failure), clearSymbols));
    }

    private static String describe(Throwable failure) {
        @Nullable String message = failure.getMessage();
        return message != null ? message : failure.getClass().getSimpleName();
    }
}
