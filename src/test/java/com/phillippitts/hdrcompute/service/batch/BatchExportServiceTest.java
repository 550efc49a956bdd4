package com.phillippitts.hdrcompute.service.batch;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.domain.StageKind;
import com.phillippitts.hdrcompute.exception.AcceleratorUnavailableException;
import com.phillippitts.hdrcompute.exception.ComputeException;
import com.phillippitts.hdrcompute.pipeline.Pipeline;
import com.phillippitts.hdrcompute.pipeline.ProcessPipe;
import com.phillippitts.hdrcompute.pipeline.Stage;
import com.phillippitts.hdrcompute.pipeline.ops.ExposureOperation;
import com.phillippitts.hdrcompute.service.accel.AcceleratedBackend;
import com.phillippitts.hdrcompute.service.accel.AcceleratedEngine;
import com.phillippitts.hdrcompute.service.metrics.ComputeMetrics;
import com.phillippitts.hdrcompute.service.worker.WorkerPool;
import com.phillippitts.hdrcompute.testutil.TestImages;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BatchExportServiceTest {

    private ExecutorService executor;
    private ScheduledExecutorService watchdog;
    private WorkerPool workerPool;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        watchdog = Executors.newSingleThreadScheduledExecutor();
        workerPool = new WorkerPool(executor, watchdog, new ComputeMetrics(new SimpleMeterRegistry()));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        watchdog.shutdownNow();
    }

    private static ProcessPipe pipe(float value) {
        ProcessPipe pipe = new ProcessPipe()
                .append("exposure", StageKind.EXPOSURE, new ExposureOperation(), Map.of(ExposureOperation.EV, 0.0));
        pipe.setInputImage(TestImages.uniform(2, 2, value));
        return pipe;
    }

    @Test
    void exportsInOrderWithoutOverlap() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        AcceleratedBackend backend = new ReplayBackend(() -> {
            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
            sleepQuietly();
            running.decrementAndGet();
        });
        BatchExportService service = new BatchExportService(new AcceleratedEngine(workerPool, backend, 0));
        RecordingSink sink = new RecordingSink();

        BatchExportSummary summary = service.exportAll(
                List.of(pipe(0.1f), pipe(0.2f), pipe(0.3f), pipe(0.4f)), false, sink).get(5, TimeUnit.SECONDS);

        assertThat(summary.isComplete()).isTrue();
        assertThat(summary.exported()).isEqualTo(4);
        assertThat(sink.indices).containsExactly(0, 1, 2, 3);
        assertThat(sink.images).extracting(image -> image.get(0, 0, 0)).containsExactly(0.1f, 0.2f, 0.3f, 0.4f);
        assertThat(sink.progress).containsExactly(25, 50, 75, 100);
        assertThat(maxRunning.get()).isEqualTo(1);
    }

    @Test
    void continuesAfterAFailedImage() throws Exception {
        AcceleratedBackend backend = new ReplayBackend(() -> { });
        BatchExportService service = new BatchExportService(new AcceleratedEngine(workerPool, backend, 0));
        RecordingSink sink = new RecordingSink();
        ProcessPipe broken = new ProcessPipe()
                .append("boom", StageKind.CUSTOM, (image, params) -> {
                    throw new IllegalStateException("corrupt raster");
                }, Map.of());
        broken.setInputImage(TestImages.uniform(2, 2, 0.5f));

        BatchExportSummary summary = service.exportAll(List.of(pipe(0.1f), broken, pipe(0.3f)), false, sink)
                .get(5, TimeUnit.SECONDS);

        assertThat(summary.exported()).isEqualTo(2);
        assertThat(summary.failedIndices()).containsExactly(1);
        assertThat(summary.isComplete()).isFalse();
        assertThat(sink.indices).containsExactly(0, 2);
        assertThat(sink.failures).singleElement()
                .satisfies(e -> assertThat(e).hasRootCauseMessage("corrupt raster"));
    }

    @Test
    void leavesCallerPipelinesUntouched() throws Exception {
        BatchExportService service = new BatchExportService(
                new AcceleratedEngine(workerPool, new ReplayBackend(() -> { }), 0));
        ProcessPipe original = pipe(0.2f);

        service.exportAll(List.of(original), true, new RecordingSink()).get(5, TimeUnit.SECONDS);

        assertThatThrownBy(() -> original.getImage(false)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void completesImmediatelyForEmptyBatch() {
        BatchExportService service = new BatchExportService(
                new AcceleratedEngine(workerPool, new ReplayBackend(() -> { }), 0));

        BatchExportSummary summary = service.exportAll(List.of(), false, new RecordingSink()).join();

        assertThat(summary.total()).isZero();
        assertThat(summary.isComplete()).isTrue();
    }

    @Test
    void refusesToStartWhenAcceleratorUnavailable() {
        AcceleratedBackend backend = mock(AcceleratedBackend.class);
        when(backend.isAvailable()).thenReturn(false);
        when(backend.name()).thenReturn("offline");
        BatchExportService service = new BatchExportService(new AcceleratedEngine(workerPool, backend, 0));

        assertThatThrownBy(() -> service.exportAll(List.of(pipe(0.1f)), false, new RecordingSink()))
                .isInstanceOf(AcceleratorUnavailableException.class);
    }

    private static void sleepQuietly() {
        try {
            Thread.sleep(20);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Replays the pipeline stages after running a probe.
     */
    private static final class ReplayBackend implements AcceleratedBackend {
        private final Runnable probe;

        ReplayBackend(Runnable probe) {
            this.probe = probe;
        }

        @Override
        public String name() {
            return "replay";
        }

        @Override
        public boolean isAvailable() {
            return true;
        }

        @Override
        public HdrImage compute(HdrImage input, Pipeline pipeline) {
            probe.run();
            HdrImage current = input;
            for (Stage stage : pipeline.stages()) {
                current = stage.apply(current);
            }
            return current;
        }
    }

    private static final class RecordingSink implements ExportSink {
        final List<Integer> indices = new ArrayList<>();
        final List<HdrImage> images = new ArrayList<>();
        final List<ComputeException> failures = new CopyOnWriteArrayList<>();
        final List<Integer> progress = new ArrayList<>();

        @Override
        public synchronized void accept(int index, HdrImage image) {
            indices.add(index);
            images.add(image);
        }

        @Override
        public void onFailed(int index, ComputeException error) {
            failures.add(error);
        }

        @Override
        public synchronized void onProgress(int percent) {
            progress.add(percent);
        }
    }
}
