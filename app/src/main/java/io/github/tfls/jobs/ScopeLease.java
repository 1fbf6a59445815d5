package io.github.tfls.jobs;

import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/** One outstanding unit of work counted against a set of scopes. Closing is idempotent. */
public final class ScopeLease implements AutoCloseable {
    private final ScopeTracker tracker;
    private final Set<Path> scopes;
    private final AtomicBoolean released = new AtomicBoolean(false);

    ScopeLease(ScopeTracker tracker, Set<Path> scopes) {
        this.tracker = tracker;
        this.scopes = scopes;
    }

    public Set<Path> scopes() {
        return scopes;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            tracker.release(this);
        }
    }
}
