package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.exception.TalkBackException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Serialized execution context that owns all mutable session state.
 *
 * <p>Every state mutation of an orchestrator runs on this single thread: entry points called by
 * clients, results posted by worker tasks and timer callbacks. Concurrent producers never touch
 * the state directly; they hand work to the loop with {@link #execute(Runnable)} or
 * {@link #call(Callable)}.
 *
 * <p>Exceptions thrown by posted tasks are logged and do not terminate the loop.
 *
 * @since 1.0
 */
final class SessionLoop implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(SessionLoop.class);

    private final ScheduledThreadPoolExecutor executor;
    private volatile Thread loopThread;

    SessionLoop(String name) {
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        };
        this.executor = new ScheduledThreadPoolExecutor(1, factory);
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    /**
     * @return {@code true} if the calling thread is the loop thread
     */
    boolean inLoop() {
        return Thread.currentThread() == loopThread;
    }

    boolean isClosed() {
        return executor.isShutdown();
    }

    /**
     * Posts a task to the loop. Tasks posted after {@link #close()} are dropped.
     */
    void execute(Runnable task) {
        try {
            executor.execute(trapping(task));
        } catch (RejectedExecutionException e) {
            LOG.debug("Session loop closed; dropping task");
        }
    }

    /**
     * Runs a task on the loop and waits for its result. Runs inline when already on the loop.
     *
     * @throws InterruptedException if the caller is interrupted while waiting
     * @throws RuntimeException the task's own runtime exception, rethrown unchanged
     */
    <T> T call(Callable<T> task) throws InterruptedException {
        if (inLoop()) {
            return invoke(task);
        }
        Future<T> future;
        try {
            future = executor.submit(() -> invoke(task));
        } catch (RejectedExecutionException e) {
            throw new TalkBackException("Session loop is closed", e);
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(false);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new TalkBackException(cause);
        }
    }

    /**
     * Schedules a task on the loop after a delay.
     *
     * @return handle for cancellation, or {@code null} if the loop is closed
     */
    ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        try {
            return executor.schedule(trapping(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Session loop closed; timer not scheduled");
            return null;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static <T> T invoke(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new TalkBackException(e);
        }
    }

    private static Runnable trapping(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.error("Session loop task failed", e);
            }
        };
    }
}
