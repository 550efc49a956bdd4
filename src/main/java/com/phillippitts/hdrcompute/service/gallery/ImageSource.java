package com.phillippitts.hdrcompute.service.gallery;

import com.phillippitts.hdrcompute.domain.HdrImage;

import java.io.IOException;

/**
 * Reads images for the gallery. File formats live outside this library; callers provide the
 * reader.
 */
@FunctionalInterface
public interface ImageSource {

    /**
     * @throws IOException if the image cannot be read; the load may be retried
     */
    HdrImage read(String filename) throws IOException;
}
