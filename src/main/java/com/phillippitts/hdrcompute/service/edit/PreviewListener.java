package com.phillippitts.hdrcompute.service.edit;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.exception.ComputeException;

/**
 * Receives the results of an {@link EditScheduler}.
 *
 * <p>Callbacks run on a worker thread; implementations that touch UI state must hand the image
 * over to their own thread.
 */
public interface PreviewListener {

    /**
     * Called once per successful run with the tone mapped output.
     */
    void onPreviewReady(HdrImage preview);

    /**
     * Called after {@link #onPreviewReady(HdrImage)} with the linear output when the HDR live
     * preview is enabled.
     */
    default void onHdrPreviewReady(HdrImage hdrImage) {
    }

    /**
     * Called once per failed run. The previous preview stays valid.
     */
    default void onComputeFailed(ComputeException error) {
    }
}
