package io.github.tfls.util;

import static org.junit.jupiter.api.Assertions.*;

import io.github.tfls.exception.GlobalExceptionHandler;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class LoggingExecutorServiceTest {

    @Test
    void testFailuresReachHandlerAndFuture() {
        List<Throwable> handled = new CopyOnWriteArrayList<>();
        var executor = new LoggingExecutorService(ExecutorServiceUtil.newFixedThreadExecutor(1, "test"), handled::add);
        try {
            var future = executor.submit(() -> {
                throw new IllegalStateException("boom");
            });

            var ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
            assertInstanceOf(IllegalStateException.class, ex.getCause());
            assertEquals(1, handled.size());
        } finally {
            executor.shutdownAndAwait(1000L, "test");
        }
    }

    @Test
    void testSubmitAfterShutdownCompletesExceptionally() {
        var executor = new LoggingExecutorService(ExecutorServiceUtil.newFixedThreadExecutor(1, "test"), th -> {});
        executor.shutdownAndAwait(1000L, "test");

        var future = executor.submit(() -> {});

        assertTrue(future.isCompletedExceptionally());
        var ex = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(RejectedExecutionException.class, ex.getCause());
    }

    @Test
    void testThreadsAreNamedDaemons() throws Exception {
        var thread = ExecutorServiceUtil.createNamedThreadFactory("tfls-test").newThread(() -> {});
        assertEquals("tfls-test-1", thread.getName());
        assertTrue(thread.isDaemon());
        assertThrows(IllegalArgumentException.class, () -> ExecutorServiceUtil.newFixedThreadExecutor(0, "none"));
    }

    @Test
    void testIsCausedByWalksTheCauseChain() {
        var wrapped = new RuntimeException(new IllegalStateException(new CancellationException()));
        assertTrue(GlobalExceptionHandler.isCausedBy(wrapped, CancellationException.class));
        assertFalse(GlobalExceptionHandler.isCausedBy(wrapped, InterruptedException.class));
    }
}
