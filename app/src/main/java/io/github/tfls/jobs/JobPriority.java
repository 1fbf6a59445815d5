package io.github.tfls.jobs;

/** Editor-driven work outranks work that came from walking or watching the disk. */
public enum JobPriority {
    BACKGROUND,
    FOREGROUND;

    public static JobPriority max(JobPriority a, JobPriority b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
