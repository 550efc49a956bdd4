package com.phillippitts.hdrcompute.service.tile;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.domain.TileCoordinate;
import com.phillippitts.hdrcompute.domain.TileGrid;
import com.phillippitts.hdrcompute.exception.ComputeException;
import com.phillippitts.hdrcompute.exception.ComputeExceptionBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * State of one tiled export: the output grid, the completion counter and the all-or-nothing
 * barrier.
 *
 * <p>Tiles may report in any order; each writes its own cell. The thread that reports the last
 * tile merges the grid and applies the deferred geometry, exactly once. The first failure ends
 * the job: remaining tiles are cancelled and late results are discarded.
 */
final class TileJob {

    private static final Logger LOG = LogManager.getLogger(TileJob.class);

    private final TileGrid outputs;
    private final int totalTiles;
    private final Optional<DeferredGeometry> geometry;
    private final ExportListener listener;
    private final Object meta;
    private final long startNanos;
    private final Runnable onTileWritten;

    private final Lock lock = new ReentrantLock();
    private final List<Future<?>> tasks = new CopyOnWriteArrayList<>();
    private final CompletableFuture<ExportResult> result = new CompletableFuture<>();

    private int tilesDone;
    private boolean finished;

    TileJob(int rows, int cols, Optional<DeferredGeometry> geometry, ExportListener listener, Object meta,
            Runnable onTileWritten) {
        this.outputs = new TileGrid(rows, cols);
        this.totalTiles = rows * cols;
        this.geometry = geometry;
        this.listener = listener;
        this.meta = meta;
        this.onTileWritten = onTileWritten;
        this.startNanos = System.nanoTime();
    }

    CompletableFuture<ExportResult> result() {
        return result;
    }

    void track(Future<?> task) {
        tasks.add(task);
        if (isFinished()) {
            task.cancel(true);
        }
    }

    boolean isFinished() {
        lock.lock();
        try {
            return finished;
        } finally {
            lock.unlock();
        }
    }

    void onTileComplete(TileCoordinate tile, HdrImage image) {
        boolean last;
        lock.lock();
        try {
            if (finished) {
                LOG.debug("Discarding tile {}: export already finished", tile);
                return;
            }
            outputs.set(tile.row(), tile.col(), image);
            tilesDone++;
            onTileWritten.run();
            notifyProgress(100 * tilesDone / totalTiles);
            last = tilesDone == totalTiles;
            if (last) {
                finished = true;
            }
        } finally {
            lock.unlock();
        }
        if (last) {
            mergeAndFinish();
        }
    }

    void onTileFailed(TileCoordinate tile, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof CancellationException && isFinished()) {
            return;
        }
        fail(ComputeExceptionBuilder.create("Tile computation failed")
                .engine(TileEngine.ENGINE)
                .tile(tile.row(), tile.col())
                .cause(cause)
                .build());
    }

    /**
     * Ends the job with {@code error} unless it already finished.
     */
    void fail(ComputeException error) {
        lock.lock();
        try {
            if (finished) {
                return;
            }
            finished = true;
        } finally {
            lock.unlock();
        }
        tasks.forEach(task -> task.cancel(true));
        notifyFailure(error);
    }

    private void mergeAndFinish() {
        HdrImage merged;
        try {
            merged = HdrImage.merge(outputs);
            if (geometry.isPresent()) {
                merged = geometry.get().applyTo(merged);
            }
        } catch (RuntimeException e) {
            notifyFailure(ComputeExceptionBuilder.create("Merging tiles failed")
                    .engine(TileEngine.ENGINE)
                    .metadata("tiles", totalTiles)
                    .cause(e)
                    .build());
            return;
        }

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000L;
        ExportResult exportResult = new ExportResult(merged, meta, totalTiles, geometry.isPresent(), durationMs);
        try {
            listener.onExportReady(merged, meta);
        } catch (RuntimeException e) {
            LOG.error("Export listener failed", e);
        }
        result.complete(exportResult);
    }

    private void notifyProgress(int percent) {
        try {
            listener.onProgress(percent);
        } catch (RuntimeException e) {
            LOG.error("Export progress listener failed", e);
        }
    }

    private void notifyFailure(ComputeException error) {
        LOG.warn("Tiled export failed: {}", error.getMessage());
        try {
            listener.onExportFailed(error);
        } catch (RuntimeException e) {
            LOG.error("Export listener failed while handling a failure", e);
        }
        result.completeExceptionally(error);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
