package io.github.tfls.exception;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import org.jetbrains.annotations.Nullable;

/** Thrown by a bounded wait when jobs for the awaited scope are still outstanding at the deadline. */
public class DeadlineExceededException extends TimeoutException {
    private final @Nullable Path scope;
    private final int outstanding;

    /** @param scope the awaited scope, or null when waiting for every scope */
    public DeadlineExceededException(@Nullable Path scope, int outstanding, Duration timeout) {
        super("Deadline of %d ms exceeded while %d jobs still outstanding for %s"
                .formatted(timeout.toMillis(), outstanding, scope == null ? "all scopes" : scope));
        this.scope = scope;
        this.outstanding = outstanding;
    }

    public @Nullable Path getScope() {
        return scope;
    }

    public int getOutstanding() {
        return outstanding;
    }
}
