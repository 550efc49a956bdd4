package com.phillippitts.hdrcompute.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for the worker pool and the tiled export engine.
 *
 * <p>Meters:
 * <ul>
 *   <li>{@code hdrcompute.task.latency}: one worker task, tagged by engine and by kind
 *       ({@code tile} for one export tile, {@code task} for a whole-pipeline run)</li>
 *   <li>{@code hdrcompute.task.success} / {@code hdrcompute.task.failure}: task outcomes,
 *       failures tagged with a reason (timeout, rejected, error, cancelled)</li>
 *   <li>{@code hdrcompute.tiles.computed}: tiles written into export grids</li>
 *   <li>{@code hdrcompute.export.duration}: wall time of a whole tiled export, split,
 *       compute and merge included, tagged by outcome and grid size</li>
 * </ul>
 */
@Component
public class ComputeMetrics {

    static final String TASK_PREFIX = "hdrcompute.task";
    static final String KIND_TILE = "tile";
    static final String KIND_TASK = "task";

    private final MeterRegistry registry;

    public ComputeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long one worker task ran.
     *
     * @param engineName engine that submitted the task
     * @param tiled whether the task computed one tile of an export
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String engineName, boolean tiled, long durationNanos) {
        Timer.builder(TASK_PREFIX + ".latency")
                .description("Time taken to run one compute task")
                .tag("engine", engineName)
                .tag("kind", tiled ? KIND_TILE : KIND_TASK)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String engineName) {
        Counter.builder(TASK_PREFIX + ".success")
                .description("Number of successful compute tasks")
                .tag("engine", engineName)
                .register(registry)
                .increment();
    }

    /**
     * @param reason timeout, rejected, error or cancelled
     */
    public void incrementFailure(String engineName, String reason) {
        Counter.builder(TASK_PREFIX + ".failure")
                .description("Number of failed compute tasks")
                .tag("engine", engineName)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementTilesComputed() {
        Counter.builder("hdrcompute.tiles.computed")
                .description("Number of tiles computed for tiled exports")
                .register(registry)
                .increment();
    }

    /**
     * Records one finished tiled export.
     *
     * @param cols grid columns
     * @param rows grid rows
     * @param success whether a merged image was produced
     * @param durationNanos time from submission of the export to its outcome
     */
    public void recordExport(int cols, int rows, boolean success, long durationNanos) {
        Timer.builder("hdrcompute.export.duration")
                .description("Wall time of a tiled export")
                .tag("outcome", success ? "success" : "failure")
                .tag("grid", cols + "x" + rows)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
