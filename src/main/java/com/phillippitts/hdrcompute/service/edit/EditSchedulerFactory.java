package com.phillippitts.hdrcompute.service.edit;

import com.phillippitts.hdrcompute.config.properties.ComputeProperties;
import com.phillippitts.hdrcompute.pipeline.Pipeline;
import com.phillippitts.hdrcompute.service.accel.AcceleratedBackend;
import com.phillippitts.hdrcompute.service.worker.WorkerPool;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Creates one {@link EditScheduler} per editing session, all sharing the application's
 * {@link WorkerPool}.
 *
 * <p>Defaults for mode, task timeout and HDR live preview come from {@code compute.edit.*}.
 */
public class EditSchedulerFactory {

    private final WorkerPool workerPool;
    private final AcceleratedBackend backend;
    private final ComputeProperties.Edit properties;
    private final ApplicationEventPublisher publisher;

    public EditSchedulerFactory(WorkerPool workerPool, AcceleratedBackend backend,
                                ComputeProperties properties, ApplicationEventPublisher publisher) {
        this.workerPool = workerPool;
        this.backend = backend;
        this.properties = properties.getEdit();
        this.publisher = publisher;
    }

    /**
     * Creates a scheduler in the configured mode.
     */
    public EditScheduler create(String sessionId, Pipeline pipeline, PreviewListener listener) {
        return create(sessionId, pipeline, listener, properties.getMode());
    }

    /**
     * Creates a scheduler in an explicit mode, e.g. {@link ComputeMode#PURE} for the aesthetics
     * preview whatever the editor uses.
     */
    public EditScheduler create(String sessionId, Pipeline pipeline, PreviewListener listener, ComputeMode mode) {
        return EditSchedulerBuilder.builder()
                .sessionId(sessionId)
                .pipeline(pipeline)
                .listener(listener)
                .workerPool(workerPool)
                .backend(backend)
                .mode(mode)
                .taskTimeoutMs(properties.getTaskTimeoutMs())
                .hdrLivePreview(properties.isHdrLivePreview())
                .publisher(publisher)
                .build();
    }
}
