package com.phillippitts.hdrcompute.domain;

/**
 * Kind of an image-transform stage.
 *
 * <p>The kind is carried on the stage descriptor itself so that engines can reason about
 * the pipeline structurally. {@link #GEOMETRY} is the only kind with scheduling semantics:
 * a trailing geometry stage is detached before tiling and applied once to the merged image.
 */
public enum StageKind {
    EXPOSURE,
    CONTRAST,
    SATURATION,
    TONE_CURVE,
    COLOR_EDITOR,
    GEOMETRY,
    CUSTOM;

    public boolean isGeometry() {
        return this == GEOMETRY;
    }
}
