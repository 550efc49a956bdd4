package com.phillippitts.hdrcompute.service.edit;

import com.phillippitts.hdrcompute.config.properties.ComputeProperties;
import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.domain.StageKind;
import com.phillippitts.hdrcompute.exception.AcceleratorUnavailableException;
import com.phillippitts.hdrcompute.exception.ComputeTimeoutException;
import com.phillippitts.hdrcompute.exception.UnknownStageException;
import com.phillippitts.hdrcompute.pipeline.ProcessPipe;
import com.phillippitts.hdrcompute.pipeline.ops.ContrastOperation;
import com.phillippitts.hdrcompute.pipeline.ops.ExposureOperation;
import com.phillippitts.hdrcompute.service.accel.StageReplayBackend;
import com.phillippitts.hdrcompute.service.events.ComputeFailedEvent;
import com.phillippitts.hdrcompute.service.metrics.ComputeMetrics;
import com.phillippitts.hdrcompute.service.worker.WorkerPool;
import com.phillippitts.hdrcompute.testutil.EventCapturingPublisher;
import com.phillippitts.hdrcompute.testutil.GatedOperation;
import com.phillippitts.hdrcompute.testutil.RecordingOperation;
import com.phillippitts.hdrcompute.testutil.RecordingPreviewListener;
import com.phillippitts.hdrcompute.testutil.SyncExecutor;
import com.phillippitts.hdrcompute.testutil.TestImages;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class EditSchedulerTest {

    private ExecutorService executor;
    private ScheduledExecutorService watchdog;
    private ComputeMetrics metrics;
    private RecordingOperation exposure;
    private RecordingOperation contrast;
    private GatedOperation gate;
    private RecordingPreviewListener listener;
    private EventCapturingPublisher publisher;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        watchdog = Executors.newSingleThreadScheduledExecutor();
        metrics = new ComputeMetrics(new SimpleMeterRegistry());
        exposure = new RecordingOperation(new ExposureOperation());
        contrast = new RecordingOperation(new ContrastOperation());
        gate = new GatedOperation();
        listener = new RecordingPreviewListener();
        publisher = new EventCapturingPublisher();
    }

    @AfterEach
    void tearDown() {
        gate.open();
        executor.shutdownNow();
        watchdog.shutdownNow();
    }

    private ProcessPipe pipeline() {
        ProcessPipe pipe = new ProcessPipe()
                .append("exposure", StageKind.EXPOSURE, exposure, Map.of(ExposureOperation.EV, 0.0))
                .append("contrast", StageKind.CONTRAST, contrast, Map.of(ContrastOperation.CONTRAST, 0.0))
                .append("gate", StageKind.CUSTOM, gate, Map.of());
        pipe.setInputImage(TestImages.uniform(4, 4, 0.1f));
        return pipe;
    }

    private EditSchedulerBuilder builder(ProcessPipe pipe, boolean async) {
        WorkerPool pool = new WorkerPool(async ? executor : new SyncExecutor(), watchdog, metrics);
        return EditSchedulerBuilder.builder()
                .sessionId("session-1")
                .pipeline(pipe)
                .listener(listener)
                .workerPool(pool)
                .publisher(publisher);
    }

    private static Map<String, Object> ev(double value) {
        return Map.of(ExposureOperation.EV, value);
    }

    @Test
    void dispatchesImmediatelyWhenIdle() {
        gate.open();
        EditScheduler scheduler = builder(pipeline(), false).build();

        RequestOutcome outcome = scheduler.requestCompute("exposure", ev(1.0));

        assertThat(outcome).isEqualTo(RequestOutcome.DISPATCHED);
        assertThat(listener.previews).hasSize(1);
        assertThat(scheduler.isBusy()).isFalse();
        assertThat(exposure.values(ExposureOperation.EV)).containsExactly(1.0);
    }

    @Test
    void coalescesRequestsArrivingDuringARunIntoOneFollowUp() throws Exception {
        ProcessPipe pipe = pipeline();
        EditScheduler scheduler = builder(pipe, true).build();

        assertThat(scheduler.requestCompute("exposure", ev(1.0))).isEqualTo(RequestOutcome.DISPATCHED);
        await().atMost(5, TimeUnit.SECONDS).until(() -> gate.entered() == 1);

        assertThat(scheduler.requestCompute("exposure", ev(2.0))).isEqualTo(RequestOutcome.QUEUED);
        assertThat(scheduler.requestCompute("contrast", Map.of(ContrastOperation.CONTRAST, 10)))
                .isEqualTo(RequestOutcome.QUEUED);
        gate.open();

        await().atMost(5, TimeUnit.SECONDS).until(() -> listener.previews.size() == 2);
        assertThat(scheduler.awaitIdle(Duration.ofSeconds(5))).isTrue();

        assertThat(gate.entered()).isEqualTo(2);
        assertThat(exposure.values(ExposureOperation.EV)).containsExactly(1.0, 2.0);
        assertThat(contrast.values(ContrastOperation.CONTRAST)).last().isEqualTo(10);

        ProcessPipe expected = pipeline();
        expected.setParameters("exposure", ev(2.0));
        expected.setParameters("contrast", Map.of(ContrastOperation.CONTRAST, 10));
        expected.compute();
        assertThat(listener.previews.get(1)).isEqualTo(expected.getImage(true));
    }

    @Test
    void requestsDuringARunReturnWithoutWaitingForTheCompute() throws Exception {
        EditScheduler scheduler = builder(pipeline(), true).build();

        scheduler.requestCompute("exposure", ev(1.0));
        await().atMost(5, TimeUnit.SECONDS).until(() -> gate.entered() == 1);

        long start = System.nanoTime();
        RequestOutcome queued = scheduler.requestCompute("exposure", ev(2.0));
        RequestOutcome dropped = scheduler.requestCompute("exposure", ev(1.0));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(queued).isEqualTo(RequestOutcome.QUEUED);
        assertThat(dropped).isEqualTo(RequestOutcome.DROPPED);
        assertThat(elapsedMs).isLessThan(500);
        assertThat(gate.running()).isEqualTo(1);
        assertThatThrownBy(() -> scheduler.requestCompute("vignette", Map.of()))
                .isInstanceOf(UnknownStageException.class);

        gate.open();
        assertThat(scheduler.awaitIdle(Duration.ofSeconds(5))).isTrue();
        assertThat(exposure.values(ExposureOperation.EV)).containsExactly(1.0, 2.0);
    }

    @Test
    void lastWriteWinsForRepeatedStage() throws Exception {
        EditScheduler scheduler = builder(pipeline(), true).build();

        scheduler.requestCompute("exposure", ev(0.5));
        await().atMost(5, TimeUnit.SECONDS).until(() -> gate.entered() == 1);
        scheduler.requestCompute("exposure", ev(1.0));
        scheduler.requestCompute("exposure", ev(1.5));
        scheduler.requestCompute("exposure", ev(-1.0));
        gate.open();

        await().atMost(5, TimeUnit.SECONDS).until(() -> listener.previews.size() == 2);
        assertThat(scheduler.awaitIdle(Duration.ofSeconds(5))).isTrue();
        assertThat(exposure.values(ExposureOperation.EV)).containsExactly(0.5, -1.0);
        assertThat(scheduler.getPipeline().getParameters("exposure")).isEqualTo(ev(-1.0));
    }

    @Test
    void neverRunsTwoComputationsAtOnceAndKeepsTheLastValue() throws Exception {
        gate.open();
        EditScheduler scheduler = builder(pipeline(), true).build();

        for (int i = 1; i <= 200; i++) {
            scheduler.requestCompute("exposure", ev(i / 100.0));
        }

        assertThat(scheduler.awaitIdle(Duration.ofSeconds(10))).isTrue();
        assertThat(gate.maxConcurrent()).isEqualTo(1);
        assertThat(scheduler.getPipeline().getParameters("exposure")).isEqualTo(ev(2.0));
        assertThat(exposure.values(ExposureOperation.EV)).last().isEqualTo(2.0);
        assertThat(listener.previews).hasSize(gate.entered());
    }

    @Test
    void dropsValueEqualToTheOneAlreadyDispatched() {
        gate.open();
        EditScheduler scheduler = builder(pipeline(), false).build();

        scheduler.requestCompute("exposure", ev(1.0));
        RequestOutcome repeat = scheduler.requestCompute("exposure", ev(1.0));

        assertThat(repeat).isEqualTo(RequestOutcome.DROPPED);
        assertThat(exposure.invocations()).hasSize(1);
        assertThat(listener.previews).hasSize(1);
    }

    @Test
    void dropsRepeatOfInFlightValue() throws Exception {
        EditScheduler scheduler = builder(pipeline(), true).build();

        scheduler.requestCompute("exposure", ev(1.0));
        await().atMost(5, TimeUnit.SECONDS).until(() -> gate.entered() == 1);

        assertThat(scheduler.requestCompute("exposure", ev(1.0))).isEqualTo(RequestOutcome.DROPPED);
        gate.open();

        assertThat(scheduler.awaitIdle(Duration.ofSeconds(5))).isTrue();
        assertThat(gate.entered()).isEqualTo(1);
    }

    @Test
    void rejectsUnknownStageWithoutQueueing() {
        EditScheduler scheduler = builder(pipeline(), false).build();

        assertThatThrownBy(() -> scheduler.requestCompute("vignette", Map.of("amount", 1)))
                .isInstanceOf(UnknownStageException.class)
                .hasMessageContaining("vignette");
        assertThat(scheduler.isBusy()).isFalse();
        assertThat(scheduler.state().pendingCount()).isZero();
        assertThat(gate.entered()).isZero();
    }

    @Test
    void failureReleasesPermitAndKeepsPreviousPreview() {
        gate.open();
        ProcessPipe pipe = pipeline().append("boom", StageKind.CUSTOM, (input, params) -> {
            if (Boolean.TRUE.equals(params.get("fail"))) {
                throw new IllegalArgumentException("stage exploded");
            }
            return input;
        }, Map.of("fail", false));
        EditScheduler scheduler = builder(pipe, false).build();

        scheduler.requestCompute("exposure", ev(1.0));
        RequestOutcome failed = scheduler.requestCompute("boom", Map.of("fail", true));

        assertThat(failed).isEqualTo(RequestOutcome.DISPATCHED);
        assertThat(listener.previews).hasSize(1);
        assertThat(listener.failures).singleElement()
                .satisfies(e -> assertThat(e).hasRootCauseMessage("stage exploded"));
        assertThat(publisher.eventsOfType(ComputeFailedEvent.class)).singleElement()
                .satisfies(event -> {
                    assertThat(event.engine()).isEqualTo(EditScheduler.ENGINE);
                    assertThat(event.context()).containsEntry("session", "session-1");
                });
        assertThat(scheduler.isBusy()).isFalse();

        assertThat(scheduler.requestCompute("boom", Map.of("fail", false))).isEqualTo(RequestOutcome.DISPATCHED);
        assertThat(listener.previews).hasSize(2);
    }

    @Test
    void errorThrownByAStageReleasesPermit() throws Exception {
        gate.open();
        ProcessPipe pipe = pipeline().append("native", StageKind.CUSTOM, (input, params) -> {
            if (Boolean.TRUE.equals(params.get("load"))) {
                throw new UnsatisfiedLinkError("no native library");
            }
            return input;
        }, Map.of("load", false));
        EditScheduler scheduler = builder(pipe, true).build();

        scheduler.requestCompute("native", Map.of("load", true));

        await().atMost(5, TimeUnit.SECONDS).until(() -> listener.failures.size() == 1);
        assertThat(listener.failures.get(0)).hasRootCauseInstanceOf(UnsatisfiedLinkError.class);
        assertThat(scheduler.awaitIdle(Duration.ofSeconds(5))).isTrue();
        assertThat(scheduler.isBusy()).isFalse();

        assertThat(scheduler.requestCompute("native", Map.of("load", false))).isEqualTo(RequestOutcome.DISPATCHED);
        await().atMost(5, TimeUnit.SECONDS).until(() -> listener.previews.size() == 1);
    }

    @Test
    void timedOutRunIsReportedAndReleasesPermit() throws Exception {
        EditScheduler scheduler = builder(pipeline(), true).taskTimeoutMs(100).build();

        scheduler.requestCompute("exposure", ev(1.0));

        await().atMost(5, TimeUnit.SECONDS).until(() -> listener.failures.size() == 1);
        assertThat(listener.failures.get(0)).isInstanceOf(ComputeTimeoutException.class);
        assertThat(scheduler.awaitIdle(Duration.ofSeconds(5))).isTrue();
        assertThat(listener.previews).isEmpty();
    }

    @Test
    void deliversHdrPreviewWhenEnabled() {
        gate.open();
        EditScheduler scheduler = builder(pipeline(), false).hdrLivePreview(true).build();

        scheduler.requestCompute("exposure", ev(4.0));

        assertThat(listener.hdrPreviews).singleElement()
                .satisfies(hdr -> assertThat(hdr.get(0, 0, 0)).isEqualTo(1.6f));
        assertThat(listener.previews).singleElement()
                .satisfies(preview -> assertThat(preview.get(0, 0, 0)).isEqualTo(1.0f));
    }

    @Test
    void acceleratedModeMatchesPureResult() {
        gate.open();
        ComputeProperties properties = new ComputeProperties();
        EditScheduler accelerated = builder(pipeline(), false)
                .mode(ComputeMode.ACCELERATED)
                .backend(new StageReplayBackend(properties))
                .build();
        RecordingPreviewListener pureListener = new RecordingPreviewListener();
        EditScheduler pure = builder(pipeline(), false).listener(pureListener).build();

        accelerated.requestCompute("exposure", ev(1.0));
        pure.requestCompute("exposure", ev(1.0));

        assertThat(accelerated.getMode()).isEqualTo(ComputeMode.ACCELERATED);
        assertThat(listener.previews).singleElement().isEqualTo(pureListener.previews.get(0));
    }

    @Test
    void acceleratedModeFailsWhenBackendUnavailable() {
        ComputeProperties properties = new ComputeProperties();
        properties.getAccelerated().setEnabled(false);
        EditScheduler scheduler = builder(pipeline(), false)
                .mode(ComputeMode.ACCELERATED)
                .backend(new StageReplayBackend(properties))
                .build();

        scheduler.requestCompute("exposure", ev(1.0));

        assertThat(listener.failures).singleElement().isInstanceOf(AcceleratorUnavailableException.class);
        assertThat(scheduler.isBusy()).isFalse();
    }

    @Test
    void acceleratedModeRequiresBackend() {
        EditSchedulerBuilder builder = builder(pipeline(), false).mode(ComputeMode.ACCELERATED);

        assertThatThrownBy(builder::build).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void setPipelineComputesNewPipelineWhenIdle() {
        gate.open();
        EditScheduler scheduler = builder(pipeline(), false).build();
        ProcessPipe replacement = pipeline();

        assertThat(scheduler.setPipeline(replacement)).isTrue();

        assertThat(scheduler.getPipeline()).isSameAs(replacement);
        assertThat(listener.previews).hasSize(1);
    }

    @Test
    void setPipelineSwitchesTheAcceptedStages() {
        gate.open();
        EditScheduler scheduler = builder(pipeline(), false).build();
        ProcessPipe replacement = new ProcessPipe()
                .append("lift", StageKind.EXPOSURE, new ExposureOperation(), Map.of(ExposureOperation.EV, 0.0));
        replacement.setInputImage(TestImages.uniform(4, 4, 0.1f));

        assertThat(scheduler.setPipeline(replacement)).isTrue();

        assertThat(scheduler.requestCompute("lift", ev(1.0))).isEqualTo(RequestOutcome.DISPATCHED);
        assertThatThrownBy(() -> scheduler.requestCompute("exposure", ev(1.0)))
                .isInstanceOf(UnknownStageException.class);
    }

    @Test
    void setPipelineRefusedWhileBusy() throws Exception {
        ProcessPipe original = pipeline();
        EditScheduler scheduler = builder(original, true).build();

        scheduler.requestCompute("exposure", ev(1.0));
        await().atMost(5, TimeUnit.SECONDS).until(() -> gate.entered() == 1);

        assertThat(scheduler.setPipeline(pipeline())).isFalse();
        assertThat(scheduler.getPipeline()).isSameAs(original);
        gate.open();
        assertThat(scheduler.awaitIdle(Duration.ofSeconds(5))).isTrue();
    }

    @Test
    void listenerExceptionDoesNotWedgeScheduler() {
        gate.open();
        EditScheduler scheduler = builder(pipeline(), false)
                .listener(preview -> {
                    throw new IllegalStateException("view closed");
                })
                .build();

        scheduler.requestCompute("exposure", ev(1.0));

        assertThat(scheduler.isBusy()).isFalse();
        assertThat(scheduler.requestCompute("exposure", ev(2.0))).isEqualTo(RequestOutcome.DISPATCHED);
    }

    @Test
    void generatesSessionIdWhenMissing() {
        EditScheduler scheduler = builder(pipeline(), false).sessionId(null).build();

        assertThat(scheduler.getSessionId()).isNotBlank();
    }
}
