/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.hdrcompute.exception.HdrComputeException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.hdrcompute.exception.ComputeException} - A pipeline run failed
 *       inside an engine (stage error, cancelled tile)</li>
 *   <li>{@link com.phillippitts.hdrcompute.exception.ComputeTimeoutException} - A compute task
 *       exceeded its deadline</li>
 *   <li>{@link com.phillippitts.hdrcompute.exception.AcceleratorUnavailableException} - The
 *       accelerated backend cannot run</li>
 *   <li>{@link com.phillippitts.hdrcompute.exception.UnknownStageException} - Parameters were
 *       sent to a stage the pipeline does not have</li>
 *   <li>{@link com.phillippitts.hdrcompute.exception.InvalidImageException} - Image or tile grid
 *       dimensions are unusable</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support chaining via a {@code cause} parameter and carry
 * context fields (e.g. {@code engineName} in {@code ComputeException}).
 *
 * @since 1.0
 */
package com.phillippitts.hdrcompute.exception;
