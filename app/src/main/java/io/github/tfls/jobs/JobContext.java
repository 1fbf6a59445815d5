package io.github.tfls.jobs;

import java.nio.file.Path;
import java.util.Set;

/** Handed to a running job body. */
public interface JobContext {

    JobId jobId();

    JobPriority priority();

    /** Scopes the running job counts against. */
    Set<Path> scopes();

    /**
     * Submits a follow-up job that inherits this job's scopes. The follow-up is counted before this job is released,
     * so a wait on any of these scopes cannot observe a spurious drain in between.
     */
    void submit(Job job);
}
