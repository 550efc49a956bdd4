package com.phillippitts.hdrcompute.service.batch;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.exception.AcceleratorUnavailableException;
import com.phillippitts.hdrcompute.exception.ComputeException;
import com.phillippitts.hdrcompute.exception.ComputeExceptionBuilder;
import com.phillippitts.hdrcompute.pipeline.Pipeline;
import com.phillippitts.hdrcompute.service.accel.AcceleratedEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Exports a list of pipelines one after another through the {@link AcceleratedEngine}.
 *
 * <p>The accelerated engine does not order concurrent calls, so this service serializes them:
 * pipeline {@code i + 1} is submitted from the completion of pipeline {@code i}. Each pipeline
 * is computed on a copy. A failed image is reported to the sink and skipped.
 */
public class BatchExportService {

    private static final Logger LOG = LogManager.getLogger(BatchExportService.class);

    private final AcceleratedEngine engine;

    public BatchExportService(AcceleratedEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * Starts a batch export.
     *
     * @param pipelines pipelines to export, in order
     * @param toneMap whether exported images are tone mapped
     * @param sink receives images, failures and progress
     * @return future completed with the summary once every pipeline was processed
     * @throws AcceleratorUnavailableException if the accelerated backend is unavailable
     */
    public CompletableFuture<BatchExportSummary> exportAll(List<? extends Pipeline> pipelines, boolean toneMap,
                                                           ExportSink sink) {
        Objects.requireNonNull(pipelines, "pipelines");
        Objects.requireNonNull(sink, "sink");
        if (!engine.isAvailable()) {
            throw new AcceleratorUnavailableException(AcceleratedEngine.ENGINE);
        }
        BatchRun run = new BatchRun(List.copyOf(pipelines), toneMap, sink);
        LOG.info("Starting batch export of {} images", pipelines.size());
        run.next();
        return run.result;
    }

    private final class BatchRun {
        private final List<Pipeline> pipelines;
        private final boolean toneMap;
        private final ExportSink sink;
        private final CompletableFuture<BatchExportSummary> result = new CompletableFuture<>();
        private final List<Integer> failed = new ArrayList<>();
        private int index;
        private int exported;

        BatchRun(List<Pipeline> pipelines, boolean toneMap, ExportSink sink) {
            this.pipelines = pipelines;
            this.toneMap = toneMap;
            this.sink = sink;
        }

        void next() {
            if (index == pipelines.size()) {
                BatchExportSummary summary = new BatchExportSummary(pipelines.size(), exported, failed);
                LOG.info("Batch export finished: {}/{} exported, failed={}", exported, pipelines.size(), failed);
                result.complete(summary);
                return;
            }
            int current = index;
            CompletableFuture<HdrImage> image;
            try {
                image = engine.runAccelerated(pipelines.get(current).copy(), toneMap, null);
            } catch (RuntimeException e) {
                image = CompletableFuture.failedFuture(e);
            }
            image.whenComplete((exportedImage, error) -> onImageDone(current, exportedImage, error));
        }

        private void onImageDone(int current, HdrImage image, Throwable error) {
            try {
                if (error == null) {
                    sink.accept(current, image);
                    exported++;
                } else {
                    ComputeException failure = toComputeException(current, error);
                    LOG.warn("Batch export of image {} failed: {}", current, failure.getMessage());
                    failed.add(current);
                    sink.onFailed(current, failure);
                }
                sink.onProgress(100 * (current + 1) / pipelines.size());
            } catch (RuntimeException e) {
                LOG.error("Export sink failed for image {}", current, e);
            }
            index = current + 1;
            next();
        }

        private ComputeException toComputeException(int current, Throwable error) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            if (cause instanceof ComputeException ce) {
                return ce;
            }
            return ComputeExceptionBuilder.create("Batch export failed")
                    .engine(AcceleratedEngine.ENGINE)
                    .metadata("image", current)
                    .cause(cause)
                    .build();
        }
    }
}
