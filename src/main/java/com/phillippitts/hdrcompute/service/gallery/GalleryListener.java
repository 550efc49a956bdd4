package com.phillippitts.hdrcompute.service.gallery;

import com.phillippitts.hdrcompute.exception.ComputeException;
import com.phillippitts.hdrcompute.pipeline.Pipeline;

/**
 * Receives gallery loads as they finish, in any order, on worker threads.
 */
public interface GalleryListener {

    /**
     * @param index absolute gallery index of the image
     * @param pipeline default pipeline over the image, already computed once
     * @param filename file the image was read from
     */
    void onImageLoaded(int index, Pipeline pipeline, String filename);

    /**
     * Called when every attempt to load an image failed.
     */
    default void onImageFailed(int index, String filename, ComputeException error) {
    }
}
