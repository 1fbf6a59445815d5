package io.github.tfls.jobs;

@FunctionalInterface
public interface JobBody {
    void run(JobContext ctx) throws Exception;
}
