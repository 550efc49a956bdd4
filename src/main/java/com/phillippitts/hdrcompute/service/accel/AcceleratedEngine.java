package com.phillippitts.hdrcompute.service.accel;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.exception.AcceleratorUnavailableException;
import com.phillippitts.hdrcompute.pipeline.Pipeline;
import com.phillippitts.hdrcompute.service.worker.ComputeTask;
import com.phillippitts.hdrcompute.service.worker.WorkerPool;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Runs one full pipeline through the accelerated backend as a single task.
 *
 * <p>No tiling, no merge, no coalescing: one call is one task and one callback. Callers that
 * need ordering (batch export, display refresh) serialize their calls themselves.
 *
 * <p>The pipeline is owned by the task until the returned future completes; the caller must not
 * mutate it in the meantime.
 */
public class AcceleratedEngine {

    private static final Logger LOG = LogManager.getLogger(AcceleratedEngine.class);

    public static final String ENGINE = "accelerated";

    private final WorkerPool workerPool;
    private final AcceleratedBackend backend;
    private final long timeoutMs;

    public AcceleratedEngine(WorkerPool workerPool, AcceleratedBackend backend, long timeoutMs) {
        this.workerPool = Objects.requireNonNull(workerPool, "workerPool");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.timeoutMs = Math.max(0, timeoutMs);
    }

    public boolean isAvailable() {
        return backend.isAvailable();
    }

    /**
     * Computes {@code pipeline} on the accelerated path.
     *
     * <p>The input image is copied before submission, the backend result is stored with
     * {@link Pipeline#setOutput(HdrImage)}, and {@code onReady} receives the (optionally tone
     * mapped) output on the worker thread.
     *
     * @param pipeline pipeline to compute
     * @param toneMap whether {@code onReady} receives the tone mapped image
     * @param onReady completion callback, may be {@code null}
     * @return future completed with the same image passed to {@code onReady}
     * @throws AcceleratorUnavailableException if the backend is not available; no fallback path
     *         is attempted
     */
    public CompletableFuture<HdrImage> runAccelerated(Pipeline pipeline, boolean toneMap,
                                                      Consumer<HdrImage> onReady) {
        Objects.requireNonNull(pipeline, "pipeline");
        if (!backend.isAvailable()) {
            throw new AcceleratorUnavailableException(backend.name());
        }
        HdrImage input = pipeline.getInputImage();
        if (input == null) {
            throw new IllegalStateException("Pipeline has no input image");
        }
        HdrImage snapshot = input.copy();

        ComputeTask task = ComputeTask.of(ENGINE, pipeline, toneMap, timeoutMs);
        LOG.debug("Submitting accelerated task {} on backend '{}'", task.id(), backend.name());
        return workerPool.submit(task, () -> {
            HdrImage output = backend.compute(snapshot, pipeline);
            pipeline.setOutput(output);
            HdrImage image = pipeline.getImage(toneMap);
            if (onReady != null) {
                onReady.accept(image);
            }
            return image;
        });
    }
}
