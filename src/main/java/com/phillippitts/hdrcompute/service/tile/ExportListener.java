package com.phillippitts.hdrcompute.service.tile;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.exception.ComputeException;

/**
 * Receives the progress and result of one tiled export.
 *
 * <p>Callbacks run on worker threads. {@link #onProgress(int)} is called under the job's lock,
 * so successive values are strictly increasing; keep it short.
 */
public interface ExportListener {

    /**
     * Called once per finished tile.
     *
     * @param percent {@code 100 * tilesDone / totalTiles}, integer division
     */
    default void onProgress(int percent) {
    }

    /**
     * Called once, after every tile is merged and any deferred geometry applied.
     *
     * @param image merged full-resolution image
     * @param meta opaque value passed to {@code runTiled}
     */
    void onExportReady(HdrImage image, Object meta);

    /**
     * Called once if any tile fails, times out or is rejected. No merge happens.
     */
    default void onExportFailed(ComputeException error) {
    }
}
