package io.github.tfls.jobs;

/** Told about a failed job before the job's scopes are released. */
@FunctionalInterface
public interface JobFailureHandler {
    void onFailure(JobId id, Throwable error);
}
