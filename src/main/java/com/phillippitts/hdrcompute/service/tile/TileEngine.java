package com.phillippitts.hdrcompute.service.tile;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.domain.TileCoordinate;
import com.phillippitts.hdrcompute.domain.TileGrid;
import com.phillippitts.hdrcompute.exception.ComputeExceptionBuilder;
import com.phillippitts.hdrcompute.exception.ComputeTimeoutException;
import com.phillippitts.hdrcompute.exception.InvalidImageException;
import com.phillippitts.hdrcompute.pipeline.Pipeline;
import com.phillippitts.hdrcompute.service.events.ComputeFailedEvent;
import com.phillippitts.hdrcompute.service.events.ExportCompletedEvent;
import com.phillippitts.hdrcompute.service.metrics.ComputeMetrics;
import com.phillippitts.hdrcompute.service.worker.ComputeTask;
import com.phillippitts.hdrcompute.service.worker.WorkerPool;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Computes one pipeline at full resolution by splitting its input into a grid of tiles and
 * running every tile on the shared {@link WorkerPool}.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>Deep-copy the pipeline; the caller's instance is never touched.</li>
 *   <li>Detach a trailing geometry stage from the copy ({@link DeferredGeometry}).</li>
 *   <li>Split the copy's input into {@code nCols x nRows} tiles.</li>
 *   <li>Run one task per tile on its own copy of the stripped pipeline, keeping at most
 *       {@code maxInFlight} of them in the pool at once.</li>
 *   <li>When the last tile reports, merge, apply the deferred geometry once, and notify.</li>
 * </ol>
 *
 * <p>The result equals the untiled computation because every stage before the trailing
 * geometry is computed per tile and the merge restores the exact original dimensions.
 *
 * <p><b>Failure:</b> if any tile fails or times out, or the whole job exceeds its deadline, the
 * export fails once with a {@link com.phillippitts.hdrcompute.exception.ComputeException}, the
 * remaining tiles are cancelled and nothing is merged.
 */
public class TileEngine {

    private static final Logger LOG = LogManager.getLogger(TileEngine.class);

    public static final String ENGINE = "tiled";

    private static final ExportListener NO_LISTENER = (image, meta) -> { };

    private final WorkerPool workerPool;
    private final ScheduledExecutorService watchdog;
    private final ComputeMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final int defaultCols;
    private final int defaultRows;
    private final long tileTimeoutMs;
    private final long jobTimeoutMs;
    private final int maxInFlight;

    public TileEngine(WorkerPool workerPool, ScheduledExecutorService watchdog, ComputeMetrics metrics,
                      ApplicationEventPublisher publisher, TileSettings settings) {
        this.workerPool = Objects.requireNonNull(workerPool, "workerPool");
        this.watchdog = Objects.requireNonNull(watchdog, "watchdog");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = publisher;
        this.defaultCols = settings.cols();
        this.defaultRows = settings.rows();
        this.tileTimeoutMs = Math.max(0, settings.tileTimeoutMs());
        this.jobTimeoutMs = Math.max(0, settings.jobTimeoutMs());
        this.maxInFlight = settings.maxInFlight();
    }

    /**
     * Runs a tiled export with the configured grid.
     *
     * @see #runTiled(Pipeline, int, int, boolean, ExportListener, Object)
     */
    public CompletableFuture<ExportResult> runTiled(Pipeline pipeline, boolean toneMap,
                                                    ExportListener listener, Object meta) {
        return runTiled(pipeline, defaultCols, defaultRows, toneMap, listener, meta);
    }

    /**
     * Runs a tiled export.
     *
     * @param pipeline pipeline to export; not mutated
     * @param nCols number of tile columns
     * @param nRows number of tile rows
     * @param toneMap whether the exported image is tone mapped
     * @param listener progress and result callbacks, may be {@code null}
     * @param meta opaque value handed back with the result
     * @return future completed with the merged image, or exceptionally with a
     *         {@link com.phillippitts.hdrcompute.exception.ComputeException}
     * @throws InvalidImageException if the grid is finer than the image
     * @throws IllegalStateException if the pipeline has no input image
     */
    public CompletableFuture<ExportResult> runTiled(Pipeline pipeline, int nCols, int nRows, boolean toneMap,
                                                    ExportListener listener, Object meta) {
        Objects.requireNonNull(pipeline, "pipeline");
        ExportListener target = listener != null ? listener : NO_LISTENER;

        Pipeline stripped = pipeline.copy();
        Optional<DeferredGeometry> geometry = DeferredGeometry.detach(stripped);
        TileGrid inputs = stripped.split(nCols, nRows);

        TileJob job = new TileJob(nRows, nCols, geometry, target, meta, metrics::incrementTilesComputed);
        LOG.info("Starting tiled export: {}x{} tiles, deferred geometry={}", nCols, nRows,
                geometry.map(DeferredGeometry::stageId).orElse("none"));
        long startNanos = System.nanoTime();

        ScheduledFuture<?> deadline = scheduleJobDeadline(job);
        job.result().whenComplete((exportResult, error) -> {
            if (deadline != null) {
                deadline.cancel(false);
            }
            if (job.result().isCancelled()) {
                job.fail(ComputeExceptionBuilder.create("Tiled export cancelled").engine(ENGINE).build());
            }
            metrics.recordExport(nCols, nRows, error == null, System.nanoTime() - startNanos);
            publishOutcome(exportResult, error, nCols, nRows);
        });

        Queue<TileCoordinate> remaining = new ConcurrentLinkedQueue<>();
        for (int row = 0; row < nRows; row++) {
            for (int col = 0; col < nCols; col++) {
                remaining.add(new TileCoordinate(row, col));
            }
        }
        // at most maxInFlight tiles sit in the pool; each finished tile hands its slot to the next
        int initial = Math.min(maxInFlight, remaining.size());
        for (int i = 0; i < initial; i++) {
            submitNextTile(job, stripped, inputs, remaining, toneMap);
        }
        return job.result();
    }

    private void submitNextTile(TileJob job, Pipeline stripped, TileGrid inputs, Queue<TileCoordinate> remaining,
                                boolean toneMap) {
        if (job.isFinished()) {
            return;
        }
        TileCoordinate tile = remaining.poll();
        if (tile == null) {
            return;
        }
        Pipeline tilePipeline = stripped.copy();
        tilePipeline.setInputImage(inputs.get(tile.row(), tile.col()));
        ComputeTask task = ComputeTask.forTile(ENGINE, tilePipeline, tile, toneMap, tileTimeoutMs);

        CompletableFuture<HdrImage> future = workerPool.submit(task, () -> {
            tilePipeline.compute();
            return tilePipeline.getImage(toneMap);
        });
        job.track(future);
        future.whenComplete((image, error) -> {
            if (error == null) {
                job.onTileComplete(tile, image);
                submitNextTile(job, stripped, inputs, remaining, toneMap);
            } else {
                job.onTileFailed(tile, error);
            }
        });
    }

    private ScheduledFuture<?> scheduleJobDeadline(TileJob job) {
        if (jobTimeoutMs <= 0) {
            return null;
        }
        return watchdog.schedule(() -> job.fail(new ComputeTimeoutException(ENGINE, jobTimeoutMs)),
                jobTimeoutMs, TimeUnit.MILLISECONDS);
    }

    private void publishOutcome(ExportResult exportResult, Throwable error, int nCols, int nRows) {
        if (publisher == null) {
            return;
        }
        if (error == null) {
            HdrImage image = exportResult.image();
            publisher.publishEvent(new ExportCompletedEvent(image.width(), image.height(), exportResult.tiles(),
                    exportResult.durationMs(), exportResult.meta()));
        } else {
            publisher.publishEvent(new ComputeFailedEvent(ENGINE, Instant.now(), error.getMessage(), error,
                    Map.of("grid", nCols + "x" + nRows)));
        }
    }

    /**
     * Grid and deadline settings of a {@link TileEngine}.
     *
     * @param cols default number of tile columns
     * @param rows default number of tile rows
     * @param tileTimeoutMs per-tile deadline, {@code 0} for none
     * @param jobTimeoutMs whole-export deadline, {@code 0} for none
     * @param maxInFlight most tiles of one export submitted to the pool at a time
     */
    public record TileSettings(int cols, int rows, long tileTimeoutMs, long jobTimeoutMs, int maxInFlight) {

        public TileSettings {
            if (cols <= 0 || rows <= 0) {
                throw new IllegalArgumentException("tile grid must be at least 1x1");
            }
            if (maxInFlight <= 0) {
                throw new IllegalArgumentException("maxInFlight must be positive");
            }
        }
    }
}
