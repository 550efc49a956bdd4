package com.phillippitts.hdrcompute.config;

import com.phillippitts.hdrcompute.config.properties.ComputeProperties;
import com.phillippitts.hdrcompute.pipeline.PipelineFactory;
import com.phillippitts.hdrcompute.service.accel.AcceleratedBackend;
import com.phillippitts.hdrcompute.service.accel.AcceleratedEngine;
import com.phillippitts.hdrcompute.service.batch.BatchExportService;
import com.phillippitts.hdrcompute.service.edit.EditSchedulerFactory;
import com.phillippitts.hdrcompute.service.gallery.GalleryLoadService;
import com.phillippitts.hdrcompute.service.metrics.ComputeMetrics;
import com.phillippitts.hdrcompute.service.tile.TileEngine;
import com.phillippitts.hdrcompute.service.worker.WorkerPool;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Wires the compute engines explicitly around the one shared {@link WorkerPool}.
 * Uses constructor injection to manage common dependencies across bean methods.
 */
@Configuration
public class EngineConfig {

    private final ComputeProperties computeProperties;
    private final ApplicationEventPublisher publisher;

    public EngineConfig(ComputeProperties computeProperties, ApplicationEventPublisher publisher) {
        this.computeProperties = computeProperties;
        this.publisher = publisher;
    }

    /**
     * Pool shared by every engine and editing session.
     */
    @Bean
    public WorkerPool workerPool(@Qualifier("computeExecutor") Executor computeExecutor,
                                 @Qualifier("computeWatchdog") ScheduledExecutorService computeWatchdog,
                                 ComputeMetrics metrics) {
        return new WorkerPool(computeExecutor, computeWatchdog, metrics);
    }

    /**
     * Tiled export engine, grid and deadlines from {@code compute.tile.*}.
     */
    @Bean
    public TileEngine tileEngine(WorkerPool workerPool,
                                 @Qualifier("computeWatchdog") ScheduledExecutorService computeWatchdog,
                                 ComputeMetrics metrics) {
        ComputeProperties.Tile tile = computeProperties.getTile();
        return new TileEngine(workerPool, computeWatchdog, metrics, publisher,
                new TileEngine.TileSettings(tile.getCols(), tile.getRows(),
                        tile.getTileTimeoutMs(), tile.getJobTimeoutMs(), tile.getMaxInFlight()));
    }

    @Bean
    public AcceleratedEngine acceleratedEngine(WorkerPool workerPool, AcceleratedBackend backend) {
        return new AcceleratedEngine(workerPool, backend, computeProperties.getAccelerated().getTimeoutMs());
    }

    @Bean
    public EditSchedulerFactory editSchedulerFactory(WorkerPool workerPool, AcceleratedBackend backend) {
        return new EditSchedulerFactory(workerPool, backend, computeProperties, publisher);
    }

    @Bean
    public BatchExportService batchExportService(AcceleratedEngine acceleratedEngine) {
        return new BatchExportService(acceleratedEngine);
    }

    @Bean
    public GalleryLoadService galleryLoadService(WorkerPool workerPool, PipelineFactory pipelineFactory) {
        return new GalleryLoadService(workerPool, pipelineFactory, computeProperties);
    }
}
