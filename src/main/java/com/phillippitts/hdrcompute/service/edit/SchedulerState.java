package com.phillippitts.hdrcompute.service.edit;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe coordination state of one {@link EditScheduler}.
 *
 * <p>{@code runInProgress} is a single permit: it is taken when a run is dispatched and only
 * given back by {@link #completeRun()} or {@link #failRun(Map, Collection)}, unless those
 * hand it straight to the next run. {@code updatePending} is only ever true while the permit is
 * held.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → RUNNING (request with something to apply, or exclusive reset)
 * RUNNING → RUNNING (run finished, updates arrived while busy: next batch dispatched)
 * RUNNING → IDLE (run finished, nothing new to apply)
 * </pre>
 *
 * <p><b>Thread Safety:</b> All methods use a {@link ReentrantLock}; requests arrive on the
 * controlling thread while completions arrive on workers.
 */
final class SchedulerState {

    private final Lock lock = new ReentrantLock();
    private final Condition idle = lock.newCondition();

    private final PendingParameterSet pending = new PendingParameterSet();
    // value most recently handed to a run, per stage
    private final Map<String, Map<String, Object>> dispatched = new HashMap<>();

    private boolean runInProgress;
    private boolean updatePending;

    /**
     * Records a request and decides whether it starts a run.
     *
     * @return the outcome, with the batch to dispatch when the outcome is
     *         {@link RequestOutcome#DISPATCHED}
     */
    Admission request(String stageId, Map<String, Object> parameters) {
        Objects.requireNonNull(stageId, "stageId");
        lock.lock();
        try {
            if (Objects.equals(dispatched.get(stageId), parameters)) {
                // already applied or being applied; only a newer pending value has to go
                if (pending.remove(stageId) == null) {
                    return Admission.DROPPED;
                }
            } else {
                pending.put(stageId, parameters);
            }

            if (runInProgress) {
                updatePending = true;
                return Admission.QUEUED;
            }
            if (pending.isEmpty()) {
                return Admission.DROPPED;
            }
            runInProgress = true;
            return new Admission(RequestOutcome.DISPATCHED, takeBatch());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes the permit for a run that applies no parameters and clears all queued state.
     *
     * @param whileLocked action run under the lock once the permit is taken
     * @return false if a run is in progress
     */
    boolean tryBeginExclusiveRun(Runnable whileLocked) {
        lock.lock();
        try {
            if (runInProgress) {
                return false;
            }
            runInProgress = true;
            updatePending = false;
            pending.clear();
            dispatched.clear();
            whileLocked.run();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends a successful run.
     *
     * @return the next batch if updates arrived while busy, otherwise {@code null} and the
     *         permit is released
     */
    Map<String, Map<String, Object>> completeRun() {
        lock.lock();
        try {
            return nextOrRelease();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends a failed run. Values the run never applied go back to the pending set unless a newer
     * value arrived; every value of the batch stops counting as dispatched, so requesting it
     * again computes again.
     *
     * @param batch the batch the failed run was given
     * @param applied stage ids whose parameters reached the pipeline
     * @return the next batch if updates arrived while busy, otherwise {@code null} and the
     *         permit is released
     */
    Map<String, Map<String, Object>> failRun(Map<String, Map<String, Object>> batch, Collection<String> applied) {
        lock.lock();
        try {
            for (Map.Entry<String, Map<String, Object>> entry : batch.entrySet()) {
                dispatched.remove(entry.getKey(), entry.getValue());
                if (!applied.contains(entry.getKey())) {
                    pending.putIfAbsent(entry.getKey(), entry.getValue());
                }
            }
            return nextOrRelease();
        } finally {
            lock.unlock();
        }
    }

    boolean isRunInProgress() {
        lock.lock();
        try {
            return runInProgress;
        } finally {
            lock.unlock();
        }
    }

    boolean isUpdatePending() {
        lock.lock();
        try {
            return updatePending;
        } finally {
            lock.unlock();
        }
    }

    int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    Map<String, Object> pendingValue(String stageId) {
        lock.lock();
        try {
            return pending.get(stageId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until no run is in progress.
     *
     * @return false if the timeout elapsed first
     */
    boolean awaitIdle(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (runInProgress) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = idle.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    private Map<String, Map<String, Object>> nextOrRelease() {
        if (updatePending && !pending.isEmpty()) {
            updatePending = false;
            return takeBatch();
        }
        updatePending = false;
        runInProgress = false;
        idle.signalAll();
        return null;
    }

    private Map<String, Map<String, Object>> takeBatch() {
        Map<String, Map<String, Object>> batch = pending.drain();
        dispatched.putAll(batch);
        return batch;
    }

    /**
     * Result of {@link #request(String, Map)}.
     */
    record Admission(RequestOutcome outcome, Map<String, Map<String, Object>> batch) {
        static final Admission QUEUED = new Admission(RequestOutcome.QUEUED, Map.of());
        static final Admission DROPPED = new Admission(RequestOutcome.DROPPED, Map.of());
    }
}
