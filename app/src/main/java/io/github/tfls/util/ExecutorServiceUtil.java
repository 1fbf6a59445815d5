package io.github.tfls.util;

import io.github.tfls.exception.GlobalExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public final class ExecutorServiceUtil {

    private ExecutorServiceUtil() {}

    public static ExecutorService newFixedThreadExecutor(int parallelism, String threadPrefix) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        return Executors.newFixedThreadPool(parallelism, createNamedThreadFactory(threadPrefix));
    }

    /** Daemon threads named {@code prefix-N}, reporting uncaught exceptions to {@link GlobalExceptionHandler}. */
    public static ThreadFactory createNamedThreadFactory(String prefix) {
        var counter = new AtomicInteger(0);
        return r -> newDaemonThread(r, prefix + "-" + counter.incrementAndGet());
    }

    public static Thread newDaemonThread(Runnable r, String name) {
        var thread = new Thread(r, name);
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(GlobalExceptionHandler::handle);
        return thread;
    }
}
