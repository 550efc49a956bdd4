package com.phillippitts.hdrcompute.exception;

/**
 * Base exception for all hdrCompute application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class HdrComputeException extends RuntimeException {

    public HdrComputeException(String message) {
        super(message);
    }

    public HdrComputeException(String message, Throwable cause) {
        super(message, cause);
    }

    public HdrComputeException(Throwable cause) {
        super(cause);
    }
}
