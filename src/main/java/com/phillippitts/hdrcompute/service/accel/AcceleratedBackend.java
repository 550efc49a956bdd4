package com.phillippitts.hdrcompute.service.accel;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.pipeline.Pipeline;

/**
 * Entry point of an accelerated compute path that runs a whole pipeline on a full image in one
 * call, parallelizing internally if it needs to.
 *
 * <p>Implementations must not mutate the pipeline; the engine assigns the returned image.
 */
public interface AcceleratedBackend {

    String name();

    /**
     * @return true if the backend can accept work right now
     */
    boolean isAvailable();

    /**
     * Runs every stage of {@code pipeline} with its current parameters over {@code input}.
     *
     * @param input defensive copy of the pipeline's input image
     * @param pipeline pipeline providing the stage list and parameters
     * @return untone-mapped output image
     */
    HdrImage compute(HdrImage input, Pipeline pipeline);
}
