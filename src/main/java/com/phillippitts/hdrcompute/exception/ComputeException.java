package com.phillippitts.hdrcompute.exception;

/**
 * Thrown when a pipeline computation fails inside one of the compute engines.
 * This may occur because a stage raised an error, a tile task was cancelled, or a task timed out.
 */
public class ComputeException extends HdrComputeException {

    private final String engineName;

    public ComputeException(String message) {
        super(message);
        this.engineName = "unknown";
    }

    public ComputeException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public ComputeException(String message, Throwable cause) {
        super(message, cause);
        this.engineName = "unknown";
    }

    public ComputeException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
