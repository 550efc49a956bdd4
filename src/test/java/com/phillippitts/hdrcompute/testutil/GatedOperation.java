package com.phillippitts.hdrcompute.testutil;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.pipeline.StageOperation;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Identity stage that blocks until the test releases it, and records every invocation.
 *
 * <p>Used to hold a run "in flight" while a test issues more requests, and to detect
 * overlapping executions.
 */
public class GatedOperation implements StageOperation {

    private final Semaphore permits = new Semaphore(0);
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxConcurrent = new AtomicInteger();
    private final AtomicInteger entered = new AtomicInteger();
    private final List<Map<String, Object>> seenParameters = new CopyOnWriteArrayList<>();
    private volatile boolean open;

    @Override
    public HdrImage apply(HdrImage input, Map<String, Object> parameters) {
        int now = running.incrementAndGet();
        maxConcurrent.accumulateAndGet(now, Math::max);
        entered.incrementAndGet();
        seenParameters.add(parameters);
        try {
            if (!open && !permits.tryAcquire(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("gate never released");
            }
            return input;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while gated", e);
        } finally {
            running.decrementAndGet();
        }
    }

    /**
     * Lets one blocked (or future) invocation through.
     */
    public void release() {
        permits.release();
    }

    /**
     * Lets every current and future invocation through.
     */
    public void open() {
        open = true;
        permits.release(1_000);
    }

    public int entered() {
        return entered.get();
    }

    public int running() {
        return running.get();
    }

    public int maxConcurrent() {
        return maxConcurrent.get();
    }

    public List<Map<String, Object>> seenParameters() {
        return seenParameters;
    }
}
