package com.phillippitts.hdrcompute.exception;

/**
 * Thrown when parameters are addressed to a stage the pipeline does not contain.
 */
public class UnknownStageException extends HdrComputeException {

    private final String stageId;

    public UnknownStageException(String stageId) {
        super("Unknown pipeline stage: " + stageId);
        this.stageId = stageId;
    }

    public String getStageId() {
        return stageId;
    }
}
