package com.phillippitts.hdrcompute.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link ComputeException} with contextual information.
 *
 * <p>The engines report failures from worker threads, so the message has to carry enough
 * context (engine, stage, tile) to be read in a log without the stack of the caller.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * // Tile failure during export
 * throw ComputeExceptionBuilder.create("Tile computation failed")
 *         .engine("tiled")
 *         .tile(1, 0)
 *         .cause(exception)
 *         .build();
 *
 * // Interactive recompute with duration
 * throw ComputeExceptionBuilder.create("Preview recompute failed")
 *         .engine("edit")
 *         .stage("exposure")
 *         .durationMs(420)
 *         .metadata("mode", "PURE")
 *         .build();
 * </pre>
 */
public final class ComputeExceptionBuilder {

    private final String message;
    private String engineName;
    private Throwable cause;
    private String stageId;
    private int[] tile;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ComputeExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static ComputeExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ComputeExceptionBuilder(message);
    }

    /**
     * Sets the engine name for the exception.
     *
     * @param engineName engine name (e.g. "edit", "tiled", "accelerated")
     * @return this builder for chaining
     */
    public ComputeExceptionBuilder engine(String engineName) {
        this.engineName = engineName;
        return this;
    }

    /**
     * Sets the root cause of the exception.
     *
     * @param cause underlying exception
     * @return this builder for chaining
     */
    public ComputeExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the pipeline stage involved in the failure.
     *
     * @param stageId stage identifier
     * @return this builder for chaining
     */
    public ComputeExceptionBuilder stage(String stageId) {
        this.stageId = stageId;
        return this;
    }

    /**
     * Sets the grid cell of the failed tile.
     *
     * @param row tile row
     * @param col tile column
     * @return this builder for chaining
     */
    public ComputeExceptionBuilder tile(int row, int col) {
        this.tile = new int[]{row, col};
        return this;
    }

    /**
     * Sets the operation duration in milliseconds.
     *
     * @param durationMs duration in milliseconds
     * @return this builder for chaining
     */
    public ComputeExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public ComputeExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the ComputeException with the configured properties.
     *
     * <p>The final message format is:
     * <pre>
     * {message} (stage={id}, tile={row},{col}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     *
     * @return constructed ComputeException
     */
    public ComputeException build() {
        String detailedMessage = buildDetailedMessage();
        String engine = engineName != null ? engineName : "unknown";

        if (cause != null) {
            return new ComputeException(detailedMessage, engine, cause);
        }
        return new ComputeException(detailedMessage, engine);
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (stageId != null) {
            details.put("stage", stageId);
        }
        if (tile != null) {
            details.put("tile", tile[0] + "," + tile[1]);
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);

        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
