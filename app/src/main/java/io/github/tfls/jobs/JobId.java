package io.github.tfls.jobs;

import io.github.tfls.indexer.DocumentId;

/** Idempotency key of a job: at most one job per id is queued, and at most one runs. */
public record JobId(JobKind kind, DocumentId target) {

    @Override
    public String toString() {
        return kind + "(" + target + ")";
    }
}
