package com.phillippitts.hdrcompute.service.events;

/**
 * Published once per successful tiled export.
 *
 * @param width merged image width after deferred geometry
 * @param height merged image height after deferred geometry
 * @param tiles number of tiles computed
 * @param durationMs wall time from submission to merge
 * @param meta opaque caller metadata passed through the export, may be {@code null}
 */
public record ExportCompletedEvent(int width, int height, int tiles, long durationMs, Object meta) {

    public ExportCompletedEvent {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        if (tiles <= 0) {
            throw new IllegalArgumentException("tiles must be positive");
        }
    }

    @Override
    public String toString() {
        return "ExportCompletedEvent[" + width + "x" + height + ", tiles=" + tiles
                + ", durationMs=" + durationMs + "]";
    }
}
