package com.phillippitts.hdrcompute.service.gallery;

import com.phillippitts.hdrcompute.config.properties.ComputeProperties;
import com.phillippitts.hdrcompute.exception.ComputeException;
import com.phillippitts.hdrcompute.exception.ComputeExceptionBuilder;
import com.phillippitts.hdrcompute.pipeline.Pipeline;
import com.phillippitts.hdrcompute.pipeline.PipelineFactory;
import com.phillippitts.hdrcompute.service.worker.ComputeTask;
import com.phillippitts.hdrcompute.service.worker.WorkerPool;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads one gallery page in parallel: one task per image reads the file, builds the default
 * pipeline and computes it once so a thumbnail can be shown.
 *
 * <p>A failed load is resubmitted until {@code compute.gallery.max-attempts} is reached, then
 * reported through {@link GalleryListener#onImageFailed(int, String, ComputeException)}.
 */
public class GalleryLoadService {

    private static final Logger LOG = LogManager.getLogger(GalleryLoadService.class);

    public static final String ENGINE = "gallery";

    private final WorkerPool workerPool;
    private final PipelineFactory pipelineFactory;
    private final int maxAttempts;

    public GalleryLoadService(WorkerPool workerPool, PipelineFactory pipelineFactory, ComputeProperties properties) {
        this(workerPool, pipelineFactory, properties.getGallery().getMaxAttempts());
    }

    GalleryLoadService(WorkerPool workerPool, PipelineFactory pipelineFactory, int maxAttempts) {
        this.workerPool = Objects.requireNonNull(workerPool, "workerPool");
        this.pipelineFactory = Objects.requireNonNull(pipelineFactory, "pipelineFactory");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
    }

    /**
     * Loads {@code filenames} as gallery images {@code firstIndex, firstIndex + 1, ...}.
     *
     * @return future completed once every image is loaded or has exhausted its attempts, with
     *         the loaded pipelines by absolute index
     */
    public CompletableFuture<Map<Integer, Pipeline>> loadPage(ImageSource source, int firstIndex,
                                                              List<String> filenames, GalleryListener listener) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(filenames, "filenames");
        Objects.requireNonNull(listener, "listener");

        Map<Integer, Pipeline> loaded = new ConcurrentHashMap<>();
        CompletableFuture<?>[] loads = new CompletableFuture<?>[filenames.size()];
        for (int i = 0; i < filenames.size(); i++) {
            CompletableFuture<Void> done = new CompletableFuture<>();
            load(source, firstIndex + i, filenames.get(i), 1, listener, loaded, done);
            loads[i] = done;
        }
        return CompletableFuture.allOf(loads).thenApply(ignored -> Map.copyOf(loaded));
    }

    private void load(ImageSource source, int index, String filename, int attempt, GalleryListener listener,
                      Map<Integer, Pipeline> loaded, CompletableFuture<Void> done) {
        ComputeTask task = ComputeTask.of(ENGINE, null, false, 0);
        workerPool.submit(task, () -> {
            Pipeline pipeline = pipelineFactory.createFor(source.read(filename));
            pipeline.compute();
            return pipeline;
        }).whenComplete((pipeline, error) -> {
            if (error == null) {
                loaded.put(index, pipeline);
                notifyLoaded(listener, index, pipeline, filename);
                done.complete(null);
            } else if (attempt < maxAttempts) {
                LOG.debug("Loading {} failed (attempt {}/{}), retrying", filename, attempt, maxAttempts);
                load(source, index, filename, attempt + 1, listener, loaded, done);
            } else {
                ComputeException failure = toComputeException(error, filename, attempt);
                LOG.warn("Giving up on {} after {} attempts: {}", filename, attempt, failure.getMessage());
                notifyFailed(listener, index, filename, failure);
                done.complete(null);
            }
        });
    }

    private static void notifyLoaded(GalleryListener listener, int index, Pipeline pipeline, String filename) {
        try {
            listener.onImageLoaded(index, pipeline, filename);
        } catch (RuntimeException e) {
            LOG.error("Gallery listener failed for image {}", index, e);
        }
    }

    private static void notifyFailed(GalleryListener listener, int index, String filename, ComputeException error) {
        try {
            listener.onImageFailed(index, filename, error);
        } catch (RuntimeException e) {
            LOG.error("Gallery listener failed for image {}", index, e);
        }
    }

    private static ComputeException toComputeException(Throwable error, String filename, int attempts) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return ComputeExceptionBuilder.create("Loading image failed")
                .engine(ENGINE)
                .metadata("file", filename)
                .metadata("attempts", attempts)
                .cause(cause)
                .build();
    }
}
