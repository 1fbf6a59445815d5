package io.github.tfls.jobs;

/**
 * Receives the total number of outstanding jobs and walk leases whenever it changes. Called on the thread that made
 * the change; implementations must be quick and must not call back into the scheduler.
 */
@FunctionalInterface
public interface ProgressListener {
    void onOutstandingChanged(int outstanding);
}
