package com.phillippitts.hdrcompute.exception;

/**
 * Thrown when a compute task exceeds its configured deadline and is interrupted.
 */
public class ComputeTimeoutException extends ComputeException {

    private final long timeoutMs;

    public ComputeTimeoutException(String engineName, long timeoutMs) {
        super("Compute task exceeded " + timeoutMs + "ms", engineName);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
