package com.phillippitts.hdrcompute.service.edit;

import com.phillippitts.hdrcompute.pipeline.Pipeline;
import com.phillippitts.hdrcompute.service.accel.AcceleratedBackend;
import com.phillippitts.hdrcompute.service.worker.WorkerPool;
import org.springframework.context.ApplicationEventPublisher;

import java.util.UUID;

/**
 * Builder for {@link EditScheduler}.
 *
 * <p>Pipeline, listener and worker pool are required; the backend is required in
 * {@link ComputeMode#ACCELERATED} mode.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * EditScheduler scheduler = EditSchedulerBuilder.builder()
 *     .sessionId("image-42")
 *     .pipeline(pipe)
 *     .listener(preview -> view.show(preview))
 *     .workerPool(workerPool)
 *     .taskTimeoutMs(30_000)
 *     .publisher(publisher)
 *     .build();
 * }</pre>
 */
public final class EditSchedulerBuilder {

    private String sessionId;
    private Pipeline pipeline;
    private PreviewListener listener;
    private WorkerPool workerPool;
    private AcceleratedBackend backend;
    private ComputeMode mode = ComputeMode.PURE;
    private long taskTimeoutMs;
    private boolean hdrLivePreview;
    private ApplicationEventPublisher publisher;

    private EditSchedulerBuilder() {
        // use builder()
    }

    public static EditSchedulerBuilder builder() {
        return new EditSchedulerBuilder();
    }

    public EditSchedulerBuilder sessionId(String sessionId) {
        this.sessionId = sessionId;
        return this;
    }

    public EditSchedulerBuilder pipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
        return this;
    }

    public EditSchedulerBuilder listener(PreviewListener listener) {
        this.listener = listener;
        return this;
    }

    public EditSchedulerBuilder workerPool(WorkerPool workerPool) {
        this.workerPool = workerPool;
        return this;
    }

    public EditSchedulerBuilder backend(AcceleratedBackend backend) {
        this.backend = backend;
        return this;
    }

    public EditSchedulerBuilder mode(ComputeMode mode) {
        this.mode = mode;
        return this;
    }

    /**
     * @param taskTimeoutMs per-run deadline, {@code 0} for none
     */
    public EditSchedulerBuilder taskTimeoutMs(long taskTimeoutMs) {
        this.taskTimeoutMs = taskTimeoutMs;
        return this;
    }

    public EditSchedulerBuilder hdrLivePreview(boolean hdrLivePreview) {
        this.hdrLivePreview = hdrLivePreview;
        return this;
    }

    public EditSchedulerBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    /**
     * @throws NullPointerException if a required dependency is missing
     * @throws IllegalArgumentException if ACCELERATED mode has no backend
     */
    public EditScheduler build() {
        if (sessionId == null || sessionId.isBlank()) {
            sessionId = UUID.randomUUID().toString();
        }
        return new EditScheduler(this);
    }

    String sessionId() {
        return sessionId;
    }

    Pipeline pipeline() {
        return pipeline;
    }

    PreviewListener listener() {
        return listener;
    }

    WorkerPool workerPool() {
        return workerPool;
    }

    AcceleratedBackend backend() {
        return backend;
    }

    ComputeMode mode() {
        return mode;
    }

    long taskTimeoutMs() {
        return taskTimeoutMs;
    }

    boolean hdrLivePreview() {
        return hdrLivePreview;
    }

    ApplicationEventPublisher publisher() {
        return publisher;
    }
}
