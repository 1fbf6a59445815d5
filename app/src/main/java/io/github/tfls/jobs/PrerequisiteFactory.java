package io.github.tfls.jobs;

import java.util.Optional;

/**
 * Builds a prerequisite job that was never submitted for a target. Returning empty means the prerequisite cannot be
 * produced (e.g. the document is gone) and the dependent may proceed without it.
 */
@FunctionalInterface
public interface PrerequisiteFactory {
    Optional<Job> create(JobId prerequisite);
}
