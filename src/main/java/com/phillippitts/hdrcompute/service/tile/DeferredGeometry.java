package com.phillippitts.hdrcompute.service.tile;

import com.phillippitts.hdrcompute.domain.HdrImage;
import com.phillippitts.hdrcompute.pipeline.Pipeline;
import com.phillippitts.hdrcompute.pipeline.Stage;

import java.util.Objects;
import java.util.Optional;

/**
 * Trailing geometry stage detached from a pipeline before tiling and applied once to the
 * merged image. Applying it per tile would rotate or crop every tile around its own origin.
 */
public final class DeferredGeometry {

    private final Stage stage;

    private DeferredGeometry(Stage stage) {
        this.stage = stage;
    }

    /**
     * Removes the last stage of {@code pipeline} if it is a geometry stage.
     *
     * @param pipeline pipeline owned by the caller; mutated
     * @return the detached stage, or empty if the last stage is not geometry
     */
    public static Optional<DeferredGeometry> detach(Pipeline pipeline) {
        Objects.requireNonNull(pipeline, "pipeline");
        Optional<Stage> last = pipeline.lastStage();
        if (last.isEmpty() || !last.get().isGeometry()) {
            return Optional.empty();
        }
        return Optional.of(new DeferredGeometry(pipeline.removeLastStage()));
    }

    public HdrImage applyTo(HdrImage merged) {
        return stage.apply(merged);
    }

    public String stageId() {
        return stage.id();
    }

    @Override
    public String toString() {
        return "DeferredGeometry[" + stage.id() + ", " + stage.parameters() + "]";
    }
}
