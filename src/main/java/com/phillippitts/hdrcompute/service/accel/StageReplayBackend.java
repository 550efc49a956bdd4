package com.phillippitts.hdrcompute.service.accel;

import com.phillippitts.hdrcompute.config.properties.ComputeProperties;
import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.exception.ComputeExceptionBuilder;
import com.phillippitts.hdrcompute.pipeline.Pipeline;
import com.phillippitts.hdrcompute.pipeline.Stage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * In-process backend: replays the pipeline's stages over the full image in a single pass,
 * without the per-stage cache of the pipeline itself.
 *
 * <p>Availability follows {@code compute.accelerated.enabled}.
 */
@Component
public class StageReplayBackend implements AcceleratedBackend {

    private static final Logger LOG = LogManager.getLogger(StageReplayBackend.class);

    static final String NAME = "stage-replay";

    private final boolean enabled;

    @Autowired
    public StageReplayBackend(ComputeProperties properties) {
        this(properties.getAccelerated().isEnabled());
    }

    StageReplayBackend(boolean enabled) {
        this.enabled = enabled;
        if (!enabled) {
            LOG.info("Accelerated backend '{}' disabled by configuration", NAME);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return enabled;
    }

    @Override
    public HdrImage compute(HdrImage input, Pipeline pipeline) {
        List<Stage> stages = pipeline.stages();
        HdrImage current = input;
        for (Stage stage : stages) {
            if (Thread.currentThread().isInterrupted()) {
                throw ComputeExceptionBuilder.create("Accelerated computation interrupted")
                        .engine(NAME)
                        .stage(stage.id())
                        .build();
            }
            current = stage.apply(current);
        }
        LOG.debug("Replayed {} stages over {}x{} image", stages.size(), input.width(), input.height());
        return current;
    }
}
