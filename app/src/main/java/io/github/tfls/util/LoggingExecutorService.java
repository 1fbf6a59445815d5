package io.github.tfls.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Wraps an executor so that every task failure reaches {@code exceptionHandler} and every submission yields a
 * {@link CompletableFuture}. A submission rejected because the executor is shut down completes exceptionally instead
 * of throwing.
 */
public class LoggingExecutorService implements Executor {
    private static final Logger logger = LogManager.getLogger(LoggingExecutorService.class);
    private final ExecutorService delegate;
    private final Consumer<Throwable> exceptionHandler;

    public LoggingExecutorService(ExecutorService delegate, Consumer<Throwable> exceptionHandler) {
        this.delegate = delegate;
        this.exceptionHandler = exceptionHandler;
    }

    public CompletableFuture<Void> submit(Runnable task) {
        var cf = new CompletableFuture<Void>();
        try {
            delegate.execute(() -> {
                try {
                    task.run();
                    cf.complete(null);
                } catch (Throwable th) {
                    exceptionHandler.accept(th);
                    cf.completeExceptionally(th);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.trace("Task rejected because executor is shut down", e);
            cf.completeExceptionally(e);
        }
        return cf;
    }

    @Override
    public void execute(Runnable command) {
        submit(command);
    }

    /**
     * Gracefully shut down and wait up to {@code timeoutMillis} for running tasks, forcing shutdownNow() if the
     * timeout elapses.
     */
    public void shutdownAndAwait(long timeoutMillis, String name) {
        delegate.shutdown();
        try {
            if (!delegate.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                logger.warn("{} did not terminate within {}ms; forcing shutdownNow()", name, timeoutMillis);
                var pending = delegate.shutdownNow();
                if (!pending.isEmpty()) {
                    logger.debug("Canceled {} queued tasks in {}", pending.size(), name);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while awaiting termination of {}", name, e);
        }
    }
}
