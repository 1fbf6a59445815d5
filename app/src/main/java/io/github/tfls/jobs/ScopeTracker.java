package io.github.tfls.jobs;

import io.github.tfls.exception.DeadlineExceededException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Outstanding-work tracking per scope path. A scope is drained when no active lease names it or any path below it.
 *
 * <p>Waiters block on a condition that is signalled on every release, so {@link #await} observes the moment the count
 * crosses zero rather than polling a snapshot. Work spawned by running work must be acquired before the parent's
 * lease is released; the scheduler and walker both follow that rule.
 */
public final class ScopeTracker {
    private static final Logger logger = LogManager.getLogger(ScopeTracker.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Set<ScopeLease> active = new HashSet<>();

    private final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();

    public ScopeLease acquire(Set<Path> scopes) {
        var normalized = scopes.stream().map(ScopeTracker::normalize).collect(Collectors.toUnmodifiableSet());
        var lease = new ScopeLease(this, normalized);
        int now;
        lock.lock();
        try {
            active.add(lease);
            now = active.size();
        } finally {
            lock.unlock();
        }
        notifyListeners(now);
        return lease;
    }

    void release(ScopeLease lease) {
        int now;
        lock.lock();
        try {
            active.remove(lease);
            now = active.size();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        notifyListeners(now);
    }

    /** Outstanding units counted against {@code scope} or any path below it. */
    public int outstanding(Path scope) {
        var normalized = normalize(scope);
        lock.lock();
        try {
            return outstandingLocked(normalized);
        } finally {
            lock.unlock();
        }
    }

    public int outstanding() {
        lock.lock();
        try {
            return active.size();
        } finally {
            lock.unlock();
        }
    }

    /** Blocks until {@code scope} is drained. Returns at once if it already is. */
    public void await(Path scope, Duration timeout) throws InterruptedException, DeadlineExceededException {
        awaitInternal(normalize(scope), timeout);
    }

    /** Blocks until nothing at all is outstanding. */
    public void awaitIdle(Duration timeout) throws InterruptedException, DeadlineExceededException {
        awaitInternal(null, timeout);
    }

    private void awaitInternal(@Nullable Path scope, Duration timeout)
            throws InterruptedException, DeadlineExceededException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            int pending;
            while ((pending = scope == null ? active.size() : outstandingLocked(scope)) > 0) {
                if (remaining <= 0) {
                    logger.debug("Wait on {} timed out with {} outstanding", scope, pending);
                    throw new DeadlineExceededException(scope, pending, timeout);
                }
                remaining = changed.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    public void addListener(ProgressListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ProgressListener listener) {
        listeners.remove(listener);
    }

    private int outstandingLocked(Path scope) {
        int sum = 0;
        for (var lease : active) {
            if (lease.scopes().stream().anyMatch(p -> p.startsWith(scope))) {
                sum++;
            }
        }
        return sum;
    }

    private void notifyListeners(int outstanding) {
        for (var listener : listeners) {
            try {
                listener.onOutstandingChanged(outstanding);
            } catch (RuntimeException e) {
                logger.warn("Progress listener failed", e);
            }
        }
    }

    private static Path normalize(Path scope) {
        return scope.toAbsolutePath().normalize();
    }
}
