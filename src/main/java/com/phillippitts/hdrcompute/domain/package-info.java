/**
 * Image data shared by the pipeline and the compute engines.
 *
 * <p>{@link com.phillippitts.hdrcompute.domain.HdrImage} is immutable, which lets the engines hand
 * the same input to several workers; {@link com.phillippitts.hdrcompute.domain.TileGrid} is the
 * mutable per-export grid that collects tile results.
 *
 * @since 1.0
 */
package com.phillippitts.hdrcompute.domain;
