package io.github.tfls.jobs;

import com.google.common.annotations.VisibleForTesting;
import io.github.tfls.exception.DeadlineExceededException;
import io.github.tfls.indexer.DocumentId;
import io.github.tfls.util.ExecutorServiceUtil;
import io.github.tfls.util.LoggingExecutorService;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Priority queue of indexing jobs drained by a fixed pool of workers.
 *
 * <ul>
 *   <li>At most one job per {@link JobId} is queued. Submitting an id that is already queued replaces the queued body
 *       in place (keeping its queue position); submitting an id that is running queues the new job behind it.
 *   <li>At most one job per target document runs at a time, so a document's state is only ever written by one job.
 *   <li>A job starts only once every prerequisite kind for its target has completed and none is queued. A
 *       prerequisite that was never submitted is requested from the {@link PrerequisiteFactory}.
 *   <li>Higher priority first; FIFO by submission within a priority.
 *   <li>A failing job is logged, reported to the {@link JobFailureHandler} and counted as completed. It is never
 *       retried.
 * </ul>
 *
 * Every queued or running job holds a {@link ScopeLease}, which is what {@link #await} waits on.
 */
public final class JobScheduler implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(JobScheduler.class);

    private static final Comparator<QueuedJob> QUEUE_ORDER = Comparator.comparing(
                    (QueuedJob q) -> q.job().priority())
            .reversed()
            .thenComparingLong(QueuedJob::seq);

    private final int workers;
    private final ScopeTracker tracker;
    private final PrerequisiteFactory prerequisiteFactory;
    private final JobFailureHandler failureHandler;
    private final LoggingExecutorService executor;

    private final Object lock = new Object();
    // guarded by lock
    private final TreeSet<QueuedJob> queue = new TreeSet<>(QUEUE_ORDER);
    private final Map<JobId, QueuedJob> queuedById = new HashMap<>();
    private final Set<DocumentId> busyTargets = new HashSet<>();
    private final Set<JobId> completed = new HashSet<>();
    private long nextSeq;
    private int running;
    private boolean closed;

    private final Map<JobId, Throwable> failures = new ConcurrentHashMap<>();

    public JobScheduler(
            int workers,
            ScopeTracker tracker,
            PrerequisiteFactory prerequisiteFactory,
            JobFailureHandler failureHandler) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got " + workers);
        }
        this.workers = workers;
        this.tracker = tracker;
        this.prerequisiteFactory = prerequisiteFactory;
        this.failureHandler = failureHandler;
        this.executor = new LoggingExecutorService(
                ExecutorServiceUtil.newFixedThreadExecutor(workers, "tfls-job"),
                th -> logger.error("Uncaught exception in job worker", th));
    }

    /** @return false if the scheduler is closed and the job was dropped */
    public boolean submit(Job job) {
        synchronized (lock) {
            if (closed) {
                logger.debug("Scheduler closed; dropping {}", job);
                return false;
            }
            enqueueLocked(job);
            dispatchLocked();
            return true;
        }
    }

    private void enqueueLocked(Job job) {
        var existing = queuedById.get(job.id());
        if (existing == null) {
            var queued = new QueuedJob(job, nextSeq++, tracker.acquire(job.scopes()));
            queue.add(queued);
            queuedById.put(job.id(), queued);
            logger.trace("Queued {}", job);
            return;
        }

        // Not started yet: the newer body wins, the original queue position is kept.
        var merged = job.withPriority(JobPriority.max(job.priority(), existing.job().priority()))
                .withAdditionalScopes(existing.job().scopes());
        var replacement = new QueuedJob(merged, existing.seq(), tracker.acquire(merged.scopes()));
        queue.remove(existing);
        queue.add(replacement);
        queuedById.put(job.id(), replacement);
        existing.lease().close();
        logger.trace("Coalesced {} into queued job", job);
    }

    private void dispatchLocked() {
        while (!closed && running < workers) {
            var next = nextEligibleLocked();
            if (next == null) {
                return;
            }
            queue.remove(next);
            queuedById.remove(next.job().id());
            busyTargets.add(next.job().id().target());
            running++;
            executor.submit(() -> execute(next)).whenComplete((ignored, th) -> {
                if (th != null) {
                    // only reachable when the executor rejected the task
                    finish(next, th);
                }
            });
        }
    }

    private @Nullable QueuedJob nextEligibleLocked() {
        while (true) {
            long seqBefore = nextSeq;
            // iterate a copy: requesting a missing prerequisite adds to the queue
            for (var candidate : new ArrayList<>(queue)) {
                if (!queue.contains(candidate)) {
                    continue;
                }
                var id = candidate.job().id();
                if (busyTargets.contains(id.target())) {
                    continue;
                }
                if (prerequisitesSatisfiedLocked(candidate)) {
                    return candidate;
                }
            }
            if (nextSeq == seqBefore) {
                return null;
            }
            // prerequisites were queued during this pass; they may be runnable
        }
    }

    private boolean prerequisitesSatisfiedLocked(QueuedJob candidate) {
        var job = candidate.job();
        boolean satisfied = true;
        for (var kind : job.prerequisites()) {
            var prerequisiteId = new JobId(kind, job.id().target());
            if (queuedById.containsKey(prerequisiteId)) {
                satisfied = false;
                continue;
            }
            if (completed.contains(prerequisiteId)) {
                continue;
            }
            Optional<Job> created = prerequisiteFactory.create(prerequisiteId);
            if (created.isPresent()) {
                logger.debug("{} requires {}; submitting it first", job.id(), prerequisiteId);
                enqueueLocked(created.get()
                        .withPriority(JobPriority.max(created.get().priority(), job.priority()))
                        .withAdditionalScopes(job.scopes()));
                satisfied = false;
            } else {
                logger.debug("{} requires {} which cannot be produced; proceeding", job.id(), prerequisiteId);
            }
        }
        return satisfied;
    }

    private void execute(QueuedJob queued) {
        var job = queued.job();
        Throwable failure = null;
        long start = System.nanoTime();
        try {
            job.body().run(new Context(job));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = e;
        } catch (Throwable th) {
            failure = th;
        }
        logger.trace("{} finished in {} us", job, (System.nanoTime() - start) / 1000);
        finish(queued, failure);
    }

    private void finish(QueuedJob queued, @Nullable Throwable failure) {
        var id = queued.job().id();
        if (failure != null) {
            logger.warn("Job {} failed: {}", id, failure.toString(), failure);
            failures.put(id, failure);
            try {
                failureHandler.onFailure(id, failure);
            } catch (RuntimeException e) {
                logger.error("Failure handler threw while recording failure of {}", id, e);
            }
        } else {
            failures.remove(id);
        }

        synchronized (lock) {
            running--;
            busyTargets.remove(id.target());
            if (id.kind().resetsTarget()) {
                completed.removeIf(c -> c.target().equals(id.target()));
                failures.keySet().removeIf(c -> c.target().equals(id.target()));
            } else {
                completed.add(id);
            }
            dispatchLocked();
        }
        // released last so that waiters see everything this job installed or submitted
        queued.lease().close();
    }

    /** Blocks until no job counted against {@code scope} (or a path below it) is queued or running. */
    public void await(Path scope, Duration timeout) throws InterruptedException, DeadlineExceededException {
        tracker.await(scope, timeout);
    }

    public void awaitIdle(Duration timeout) throws InterruptedException, DeadlineExceededException {
        tracker.awaitIdle(timeout);
    }

    public int outstanding(Path scope) {
        return tracker.outstanding(scope);
    }

    public Optional<Throwable> lastFailure(JobId id) {
        return Optional.ofNullable(failures.get(id));
    }

    @VisibleForTesting
    boolean isQueued(JobId id) {
        synchronized (lock) {
            return queuedById.containsKey(id);
        }
    }

    @VisibleForTesting
    boolean hasCompleted(JobId id) {
        synchronized (lock) {
            return completed.contains(id);
        }
    }

    /** Drops queued jobs, lets running ones finish, and stops the workers. */
    @Override
    public void close() {
        List<QueuedJob> dropped;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            dropped = new ArrayList<>(queue);
            queue.clear();
            queuedById.clear();
        }
        if (!dropped.isEmpty()) {
            logger.debug("Dropping {} queued jobs on close", dropped.size());
        }
        dropped.forEach(q -> q.lease().close());
        executor.shutdownAndAwait(5000L, "JobScheduler");
    }

    private record QueuedJob(Job job, long seq, ScopeLease lease) {}

    private final class Context implements JobContext {
        private final Job job;

        Context(Job job) {
            this.job = job;
        }

        @Override
        public JobId jobId() {
            return job.id();
        }

        @Override
        public JobPriority priority() {
            return job.priority();
        }

        @Override
        public Set<Path> scopes() {
            return job.scopes();
        }

        @Override
        public void submit(Job followUp) {
            JobScheduler.this.submit(followUp.withAdditionalScopes(job.scopes()));
        }
    }
}
