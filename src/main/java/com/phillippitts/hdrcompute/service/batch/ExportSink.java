package com.phillippitts.hdrcompute.service.batch;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.exception.ComputeException;

/**
 * Destination of a batch export. Calls arrive one at a time, in index order.
 */
public interface ExportSink {

    /**
     * Receives the computed image of pipeline {@code index}.
     */
    void accept(int index, HdrImage image);

    /**
     * Called when pipeline {@code index} could not be computed; the batch continues.
     */
    default void onFailed(int index, ComputeException error) {
    }

    /**
     * Called after each pipeline, successful or not.
     *
     * @param percent {@code 100 * processed / total}
     */
    default void onProgress(int percent) {
    }
}
