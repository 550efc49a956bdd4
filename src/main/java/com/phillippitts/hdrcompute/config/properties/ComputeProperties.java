package com.phillippitts.hdrcompute.config.properties;

import com.phillippitts.hdrcompute.service.edit.ComputeMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the compute engines ({@code compute.*}).
 *
 * <p>Timeouts of {@code 0} disable the corresponding deadline.
 */
@Validated
@ConfigurationProperties(prefix = "compute")
public class ComputeProperties {

    @Valid
    private Edit edit = new Edit();

    @Valid
    private Tile tile = new Tile();

    @Valid
    private Accelerated accelerated = new Accelerated();

    @Valid
    private Gallery gallery = new Gallery();

    public Edit getEdit() {
        return edit;
    }

    public void setEdit(Edit edit) {
        this.edit = edit;
    }

    public Tile getTile() {
        return tile;
    }

    public void setTile(Tile tile) {
        this.tile = tile;
    }

    public Accelerated getAccelerated() {
        return accelerated;
    }

    public void setAccelerated(Accelerated accelerated) {
        this.accelerated = accelerated;
    }

    public Gallery getGallery() {
        return gallery;
    }

    public void setGallery(Gallery gallery) {
        this.gallery = gallery;
    }

    /**
     * Interactive preview scheduling.
     */
    public static class Edit {
        @NotNull
        private ComputeMode mode = ComputeMode.PURE;

        @Min(0)
        private long taskTimeoutMs = 30_000;

        /**
         * Also deliver the non tone-mapped image after each recompute (external HDR display).
         */
        private boolean hdrLivePreview = false;

        public ComputeMode getMode() {
            return mode;
        }

        public void setMode(ComputeMode mode) {
            this.mode = mode;
        }

        public long getTaskTimeoutMs() {
            return taskTimeoutMs;
        }

        public void setTaskTimeoutMs(long taskTimeoutMs) {
            this.taskTimeoutMs = taskTimeoutMs;
        }

        public boolean isHdrLivePreview() {
            return hdrLivePreview;
        }

        public void setHdrLivePreview(boolean hdrLivePreview) {
            this.hdrLivePreview = hdrLivePreview;
        }
    }

    /**
     * Tiled full-resolution computation.
     */
    public static class Tile {
        @Min(1)
        @Max(64)
        private int cols = 2;

        @Min(1)
        @Max(64)
        private int rows = 2;

        @Min(0)
        private long tileTimeoutMs = 120_000;

        @Min(0)
        private long jobTimeoutMs = 600_000;

        // keep below threadpool.compute.queue-capacity so one export cannot fill the queue
        @Min(1)
        private int maxInFlight = 32;

        public int getCols() {
            return cols;
        }

        public void setCols(int cols) {
            this.cols = cols;
        }

        public int getRows() {
            return rows;
        }

        public void setRows(int rows) {
            this.rows = rows;
        }

        public long getTileTimeoutMs() {
            return tileTimeoutMs;
        }

        public void setTileTimeoutMs(long tileTimeoutMs) {
            this.tileTimeoutMs = tileTimeoutMs;
        }

        public long getJobTimeoutMs() {
            return jobTimeoutMs;
        }

        public void setJobTimeoutMs(long jobTimeoutMs) {
            this.jobTimeoutMs = jobTimeoutMs;
        }

        public int getMaxInFlight() {
            return maxInFlight;
        }

        public void setMaxInFlight(int maxInFlight) {
            this.maxInFlight = maxInFlight;
        }
    }

    /**
     * Single-shot accelerated path.
     */
    public static class Accelerated {
        private boolean enabled = true;

        @Min(0)
        private long timeoutMs = 300_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    /**
     * Gallery thumbnail loading.
     */
    public static class Gallery {
        @Min(1)
        private int maxAttempts = 3;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }
}
