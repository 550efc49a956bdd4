package com.phillippitts.hdrcompute.service.edit;

/**
 * How an {@link EditScheduler} computes the shared pipeline.
 */
public enum ComputeMode {
    /** {@code Pipeline.compute()} with per-stage caching. */
    PURE,
    /** Whole-image replay through the accelerated backend, result stored with {@code setOutput}. */
    ACCELERATED
}
