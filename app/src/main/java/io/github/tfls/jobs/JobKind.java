package io.github.tfls.jobs;

import java.util.Set;

/** The kinds of indexing work, with the kinds that must have completed first for the same document. */
public enum JobKind {
    PARSE,
    DECODE_SYMBOLS(PARSE),
    DECODE_MODULE_CALLS(DECODE_SYMBOLS),
    /** Drops the document; completion history for the target is forgotten afterwards. */
    REMOVE;

    private final Set<JobKind> prerequisites;

    JobKind(JobKind... prerequisites) {
        this.prerequisites = Set.of(prerequisites);
    }

    public Set<JobKind> prerequisites() {
        return prerequisites;
    }

    boolean resetsTarget() {
        return this == REMOVE;
    }
}
