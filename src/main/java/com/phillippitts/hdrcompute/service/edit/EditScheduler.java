package com.phillippitts.hdrcompute.service.edit;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.exception.AcceleratorUnavailableException;
import com.phillippitts.hdrcompute.exception.ComputeException;
import com.phillippitts.hdrcompute.exception.ComputeExceptionBuilder;
import com.phillippitts.hdrcompute.exception.UnknownStageException;
import com.phillippitts.hdrcompute.pipeline.Pipeline;
import com.phillippitts.hdrcompute.pipeline.Stage;
import com.phillippitts.hdrcompute.service.accel.AcceleratedBackend;
import com.phillippitts.hdrcompute.service.events.ComputeFailedEvent;
import com.phillippitts.hdrcompute.service.worker.ComputeTask;
import com.phillippitts.hdrcompute.service.worker.WorkerPool;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * Debounced, single-flight recompute of one shared pipeline for live preview.
 *
 * <p>At most one run per scheduler executes at any time. Requests that arrive while a run is in
 * progress are coalesced in a {@link PendingParameterSet} (last write wins per stage) and all
 * applied together by the next run, which is dispatched as soon as the current one finishes.
 * The pipeline applies them in its own stage order regardless of arrival order.
 *
 * <p><b>Threading:</b> {@link #requestCompute(String, Map)} never blocks and may be called from
 * any thread. Runs execute on the shared {@link WorkerPool}; listener callbacks are invoked on
 * the worker that finished the run. The shared pipeline is only mutated by the run holding the
 * permit.
 *
 * <p><b>Failure:</b> the permit is always released. The previous preview stays valid, the
 * listener's {@link PreviewListener#onComputeFailed(ComputeException)} fires and a
 * {@link ComputeFailedEvent} is published. There is no automatic retry.
 *
 * @see SchedulerState
 * @see EditSchedulerBuilder
 */
public class EditScheduler {

    private static final Logger LOG = LogManager.getLogger(EditScheduler.class);

    public static final String ENGINE = "edit";

    private final String sessionId;
    private final PreviewListener listener;
    private final WorkerPool workerPool;
    private final AcceleratedBackend backend;
    private final ComputeMode mode;
    private final long taskTimeoutMs;
    private final boolean hdrLivePreview;
    private final ApplicationEventPublisher publisher;

    private final SchedulerState state = new SchedulerState();

    // swapped only while idle, under the state lock
    private volatile Pipeline pipeline;

    // read without touching the pipeline, which is locked for the whole of a compute
    private volatile Set<String> stageIds;

    EditScheduler(EditSchedulerBuilder builder) {
        this.sessionId = builder.sessionId();
        this.pipeline = Objects.requireNonNull(builder.pipeline(), "pipeline");
        this.stageIds = stageIds(pipeline);
        this.listener = Objects.requireNonNull(builder.listener(), "listener");
        this.workerPool = Objects.requireNonNull(builder.workerPool(), "workerPool");
        this.mode = Objects.requireNonNull(builder.mode(), "mode");
        this.backend = builder.backend();
        if (mode == ComputeMode.ACCELERATED && backend == null) {
            throw new IllegalArgumentException("ACCELERATED mode requires a backend");
        }
        this.taskTimeoutMs = Math.max(0, builder.taskTimeoutMs());
        this.hdrLivePreview = builder.hdrLivePreview();
        this.publisher = builder.publisher();
    }

    /**
     * Requests that {@code stageId} be recomputed with {@code parameters}.
     *
     * <p>If idle, dispatches a run with everything pending. If busy, queues the value for the
     * next run. A value equal to the one already dispatched for the stage is dropped.
     *
     * @param stageId pipeline stage identifier
     * @param parameters new stage parameters; copied on entry
     * @return what happened to the request
     * @throws UnknownStageException if the pipeline has no such stage; nothing is queued
     */
    public RequestOutcome requestCompute(String stageId, Map<String, Object> parameters) {
        Objects.requireNonNull(stageId, "stageId");
        Objects.requireNonNull(parameters, "parameters");
        if (!stageIds.contains(stageId)) {
            throw new UnknownStageException(stageId);
        }
        Map<String, Object> copy = Map.copyOf(new LinkedHashMap<>(parameters));

        SchedulerState.Admission admission = state.request(stageId, copy);
        switch (admission.outcome()) {
            case DISPATCHED -> dispatch(admission.batch());
            case QUEUED -> LOG.debug("[{}] Run in progress, queued {}", sessionId, stageId);
            case DROPPED -> LOG.debug("[{}] Dropped {}: value already dispatched", sessionId, stageId);
            default -> throw new IllegalStateException("Unexpected outcome: " + admission.outcome());
        }
        return admission.outcome();
    }

    /**
     * Replaces the shared pipeline and computes it once.
     *
     * <p>Only possible while idle. Pending and previously dispatched values are forgotten.
     *
     * @return false if a run is in progress and the pipeline was not replaced
     */
    public boolean setPipeline(Pipeline newPipeline) {
        Objects.requireNonNull(newPipeline, "newPipeline");
        Set<String> newStageIds = stageIds(newPipeline);
        boolean replaced = state.tryBeginExclusiveRun(() -> {
            this.pipeline = newPipeline;
            this.stageIds = newStageIds;
        });
        if (!replaced) {
            LOG.debug("[{}] Pipeline not replaced: run in progress", sessionId);
            return false;
        }
        dispatch(Map.of());
        return true;
    }

    private static Set<String> stageIds(Pipeline pipeline) {
        return pipeline.stages().stream().map(Stage::id).collect(Collectors.toUnmodifiableSet());
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public ComputeMode getMode() {
        return mode;
    }

    public String getSessionId() {
        return sessionId;
    }

    public boolean isBusy() {
        return state.isRunInProgress();
    }

    /**
     * Blocks until no run is in progress.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        return state.awaitIdle(timeout);
    }

    // Package-private for tests
    SchedulerState state() {
        return state;
    }

    private void dispatch(Map<String, Map<String, Object>> batch) {
        Pipeline target = pipeline;
        List<String> applied = new ArrayList<>(batch.size());
        ComputeTask task = ComputeTask.of(ENGINE, target, true, taskTimeoutMs);
        LOG.debug("[{}] Dispatching run {} with stages {}", sessionId, task.id(), batch.keySet());

        workerPool.submit(task, () -> execute(target, batch, applied))
                .whenComplete((output, error) -> onTaskComplete(batch, applied, output, error));
    }

    private RunOutput execute(Pipeline target, Map<String, Map<String, Object>> batch, List<String> applied) {
        for (Map.Entry<String, Map<String, Object>> entry : batch.entrySet()) {
            target.setParameters(entry.getKey(), entry.getValue());
            synchronized (applied) {
                applied.add(entry.getKey());
            }
        }
        if (mode == ComputeMode.ACCELERATED) {
            if (!backend.isAvailable()) {
                throw new AcceleratorUnavailableException(backend.name());
            }
            target.setOutput(backend.compute(target.getInputImage().copy(), target));
        } else {
            target.compute();
        }
        HdrImage preview = target.getImage(true);
        HdrImage hdr = hdrLivePreview ? target.getImage(false) : null;
        return new RunOutput(preview, hdr);
    }

    private void onTaskComplete(Map<String, Map<String, Object>> batch, List<String> applied,
                                RunOutput output, Throwable error) {
        try {
            if (error == null) {
                deliver(output);
            } else {
                reportFailure(batch, error);
            }
        } finally {
            Map<String, Map<String, Object>> next;
            if (error == null) {
                next = state.completeRun();
            } else {
                synchronized (applied) {
                    next = state.failRun(batch, List.copyOf(applied));
                }
            }
            if (next != null) {
                dispatch(next);
            }
        }
    }

    private void deliver(RunOutput output) {
        try {
            listener.onPreviewReady(output.preview());
            if (output.hdr() != null) {
                listener.onHdrPreviewReady(output.hdr());
            }
        } catch (RuntimeException e) {
            LOG.error("[{}] Preview listener failed", sessionId, e);
        }
    }

    private void reportFailure(Map<String, Map<String, Object>> batch, Throwable error) {
        ComputeException failure = toComputeException(error, batch);
        LOG.warn("[{}] Recompute failed: {}", sessionId, failure.getMessage());
        try {
            listener.onComputeFailed(failure);
        } catch (RuntimeException e) {
            LOG.error("[{}] Preview listener failed while handling a compute failure", sessionId, e);
        }
        if (publisher != null) {
            publisher.publishEvent(new ComputeFailedEvent(ENGINE, Instant.now(), failure.getMessage(), failure,
                    Map.of("session", sessionId, "stages", String.join(",", batch.keySet()),
                            "mode", mode.name())));
        }
    }

    private static ComputeException toComputeException(Throwable error, Map<String, Map<String, Object>> batch) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof ComputeException ce) {
            return ce;
        }
        String message = cause instanceof CancellationException ? "Recompute cancelled" : "Recompute failed";
        return ComputeExceptionBuilder.create(message)
                .engine(ENGINE)
                .metadata("stages", String.join(",", batch.keySet()))
                .cause(cause)
                .build();
    }

    private record RunOutput(HdrImage preview, HdrImage hdr) {
    }
}
