/**
 * Image pipeline consumed by the compute engines.
 *
 * <p>{@link com.phillippitts.hdrcompute.pipeline.Pipeline} is the contract; the engines only call
 * it. {@link com.phillippitts.hdrcompute.pipeline.ProcessPipe} is the in-process implementation and
 * the {@code ops} sub-package holds the few stage operations needed to drive it.
 *
 * @since 1.0
 */
package com.phillippitts.hdrcompute.pipeline;
