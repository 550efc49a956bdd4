package com.phillippitts.hdrcompute.service.worker;

import com.phillippitts.hdrcompute.domain.TileCoordinate;
import com.phillippitts.hdrcompute.pipeline.Pipeline;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Immutable description of one unit of work submitted to the {@link WorkerPool}.
 *
 * <p>Created per dispatch and discarded once the task's future completes.
 *
 * @param engine engine name used for logging and metrics (edit, tiled, accelerated, gallery)
 * @param id unique task identifier within this process
 * @param pipeline pipeline (or pipeline copy) the task operates on, {@code null} for load tasks
 * @param tile tile coordinate for tiled work, {@code null} otherwise
 * @param toneMap whether the produced image is tone mapped
 * @param timeoutMs deadline measured from the start of execution, {@code 0} for none
 */
public record ComputeTask(String engine, String id, Pipeline pipeline, TileCoordinate tile,
                          boolean toneMap, long timeoutMs) {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    public ComputeTask {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(id, "id");
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be >= 0");
        }
    }

    public static ComputeTask of(String engine, Pipeline pipeline, boolean toneMap, long timeoutMs) {
        return new ComputeTask(engine, nextId(engine), pipeline, null, toneMap, timeoutMs);
    }

    public static ComputeTask forTile(String engine, Pipeline pipeline, TileCoordinate tile,
                                      boolean toneMap, long timeoutMs) {
        Objects.requireNonNull(tile, "tile");
        return new ComputeTask(engine, nextId(engine), pipeline, tile, toneMap, timeoutMs);
    }

    public boolean isTiled() {
        return tile != null;
    }

    private static String nextId(String engine) {
        return engine + "-" + SEQUENCE.incrementAndGet();
    }
}
