package com.phillippitts.hdrcompute.service.worker;

import com.phillippitts.hdrcompute.exception.ComputeException;
import com.phillippitts.hdrcompute.exception.ComputeExceptionBuilder;
import com.phillippitts.hdrcompute.exception.ComputeTimeoutException;
import com.phillippitts.hdrcompute.service.metrics.ComputeMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared, bounded pool that runs compute tasks for every engine and editing session.
 *
 * <p>Each submission returns a {@link CompletableFuture} that completes exactly once, and only
 * after the work has really returned. This matters to callers that own a resource for the
 * duration of the task (the edit scheduler's permit): a future that completed at the deadline
 * would let the next run start while the timed-out one still mutates the pipeline.
 *
 * <p><b>Timeouts:</b> the deadline is measured from the start of execution, not submission, so
 * a task waiting in the queue is not charged for it. When it passes, the worker thread is
 * interrupted and the future fails with {@link ComputeTimeoutException} once the work returns.
 * Pipelines check the interrupt flag between stages.
 *
 * <p><b>Cancellation:</b> cancelling the returned future interrupts a running task; a task
 * cancelled while still queued is skipped.
 *
 * <p><b>Rejection:</b> a full pool fails the future with a {@link ComputeException}; the
 * submitting thread never runs the work itself.
 *
 * <p><b>Errors:</b> an {@link Error} thrown by the work also fails the future, so no caller is
 * left waiting. A {@link VirtualMachineError} is rethrown afterwards to the executor.
 */
public class WorkerPool {

    private static final Logger LOG = LogManager.getLogger(WorkerPool.class);

    static final String CTX_ENGINE = "engine";
    static final String CTX_TASK = "task";
    static final String CTX_TILE = "tile";

    private final Executor executor;
    private final ScheduledExecutorService watchdog;
    private final ComputeMetrics metrics;

    /**
     * @param executor bounded pool that runs the work
     * @param watchdog scheduler used only to enforce deadlines
     * @param metrics task metrics
     */
    public WorkerPool(Executor executor, ScheduledExecutorService watchdog, ComputeMetrics metrics) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.watchdog = Objects.requireNonNull(watchdog, "watchdog");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Submits {@code work} described by {@code task}.
     *
     * @return future completed with the work's result, or exceptionally with a
     *         {@link ComputeException} (never a raw checked exception)
     */
    public <T> CompletableFuture<T> submit(ComputeTask task, Callable<T> work) {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(work, "work");

        CompletableFuture<T> result = new CompletableFuture<>();
        RunnerHandle handle = new RunnerHandle();
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                handle.interrupt();
            }
        });

        try {
            executor.execute(() -> run(task, work, result, handle));
        } catch (RejectedExecutionException e) {
            LOG.warn("Compute pool rejected task {}", task.id());
            metrics.incrementFailure(task.engine(), "rejected");
            result.completeExceptionally(ComputeExceptionBuilder.create("Compute pool rejected task")
                    .engine(task.engine())
                    .metadata("task", task.id())
                    .cause(e)
                    .build());
        }
        return result;
    }

    private <T> void run(ComputeTask task, Callable<T> work, CompletableFuture<T> result, RunnerHandle handle) {
        if (result.isDone()) {
            LOG.debug("Skipping task {}: cancelled before start", task.id());
            return;
        }
        handle.start(Thread.currentThread());
        AtomicBoolean timedOut = new AtomicBoolean();
        ScheduledFuture<?> deadline = scheduleDeadline(task, handle, timedOut);

        ThreadContext.put(CTX_ENGINE, task.engine());
        ThreadContext.put(CTX_TASK, task.id());
        if (task.isTiled()) {
            ThreadContext.put(CTX_TILE, task.tile().toString());
        }

        long t0 = System.nanoTime();
        try {
            T value = work.call();
            if (timedOut.get()) {
                fail(task, result, new ComputeTimeoutException(task.engine(), task.timeoutMs()), "timeout");
            } else if (result.complete(value)) {
                metrics.incrementSuccess(task.engine());
            }
        } catch (Throwable t) {
            if (timedOut.get()) {
                ComputeTimeoutException timeout = new ComputeTimeoutException(task.engine(), task.timeoutMs());
                timeout.initCause(t);
                fail(task, result, timeout, "timeout");
            } else if (t instanceof ComputeException ce) {
                fail(task, result, ce, "error");
            } else {
                if (t instanceof Error) {
                    LOG.error("Task {} died with {}", task.id(), t.toString(), t);
                }
                fail(task, result, wrap(task, t), "error");
            }
            // the future is settled; the thread itself cannot be trusted after these
            if (t instanceof VirtualMachineError vme) {
                throw vme;
            }
        } finally {
            long durationNanos = System.nanoTime() - t0;
            metrics.recordLatency(task.engine(), task.isTiled(), durationNanos);
            if (deadline != null) {
                deadline.cancel(false);
            }
            handle.finish();
            // a late timeout or cancel must not leak into the next task on this thread
            Thread.interrupted();
            ThreadContext.remove(CTX_ENGINE);
            ThreadContext.remove(CTX_TASK);
            ThreadContext.remove(CTX_TILE);
            LOG.debug("Task {} finished in {} ms", task.id(), durationNanos / 1_000_000L);
        }
    }

    private ScheduledFuture<?> scheduleDeadline(ComputeTask task, RunnerHandle handle, AtomicBoolean timedOut) {
        if (task.timeoutMs() <= 0) {
            return null;
        }
        return watchdog.schedule(() -> {
            timedOut.set(true);
            LOG.warn("Task {} exceeded {} ms, interrupting", task.id(), task.timeoutMs());
            handle.interrupt();
        }, task.timeoutMs(), TimeUnit.MILLISECONDS);
    }

    private <T> void fail(ComputeTask task, CompletableFuture<T> result, ComputeException error, String reason) {
        if (result.completeExceptionally(error)) {
            metrics.incrementFailure(task.engine(), reason);
        } else if (result.isCancelled()) {
            metrics.incrementFailure(task.engine(), "cancelled");
        }
    }

    private static ComputeException wrap(ComputeTask task, Throwable t) {
        String detail = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        ComputeExceptionBuilder builder = ComputeExceptionBuilder.create("Compute task failed: " + detail)
                .engine(task.engine())
                .cause(t);
        if (task.isTiled()) {
            builder.tile(task.tile().row(), task.tile().col());
        }
        return builder.build();
    }

    /**
     * Thread currently running one task. Interrupts are only delivered while the task runs.
     */
    private static final class RunnerHandle {
        private Thread runner;

        synchronized void start(Thread thread) {
            this.runner = thread;
        }

        synchronized void finish() {
            this.runner = null;
        }

        synchronized void interrupt() {
            if (runner != null) {
                runner.interrupt();
            }
        }
    }
}
