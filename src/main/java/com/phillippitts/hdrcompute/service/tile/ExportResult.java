package com.phillippitts.hdrcompute.service.tile;

import com.phillippitts.hdrcompute.domain.HdrImage;

import java.util.Objects;

/**
 * Outcome of a successful tiled export.
 *
 * @param image merged image, geometry applied
 * @param meta opaque caller value passed through the export, may be {@code null}
 * @param tiles number of tiles computed
 * @param geometryApplied whether a deferred geometry stage was applied after the merge
 * @param durationMs time from submission to merge
 */
public record ExportResult(HdrImage image, Object meta, int tiles, boolean geometryApplied, long durationMs) {

    public ExportResult {
        Objects.requireNonNull(image, "image");
    }
}
