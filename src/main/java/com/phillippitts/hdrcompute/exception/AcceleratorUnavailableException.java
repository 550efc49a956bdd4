package com.phillippitts.hdrcompute.exception;

/**
 * Thrown when the accelerated compute path is requested but its backend cannot run.
 * There is no fallback to tiled execution; callers decide which engine to use.
 */
public class AcceleratorUnavailableException extends ComputeException {

    public AcceleratorUnavailableException(String backendName) {
        super("Accelerated backend is not available", backendName);
    }
}
