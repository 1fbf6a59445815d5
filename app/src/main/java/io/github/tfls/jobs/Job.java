package io.github.tfls.jobs;

import io.github.tfls.indexer.DocumentId;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/** A unit of deferred indexing work. Immutable; coalescing produces a new instance. */
public record Job(JobId id, JobPriority priority, Set<Path> scopes, JobBody body) {

    public Job {
        scopes = Set.copyOf(scopes);
    }

    /** A job scoped to its own target document. */
    public static Job of(JobKind kind, DocumentId target, JobPriority priority, JobBody body) {
        return new Job(new JobId(kind, target), priority, Set.of(target.absPath()), body);
    }

    public Set<JobKind> prerequisites() {
        return id.kind().prerequisites();
    }

    public Job withPriority(JobPriority newPriority) {
        return new Job(id, newPriority, scopes, body);
    }

    public Job withAdditionalScopes(Set<Path> extra) {
        if (scopes.containsAll(extra)) {
            return this;
        }
        var merged = new HashSet<>(scopes);
        merged.addAll(extra);
        return new Job(id, priority, merged, body);
    }

    @Override
    public String toString() {
        return id + "[" + priority + "]";
    }
}
