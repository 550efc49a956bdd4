package com.phillippitts.hdrcompute.service.batch;

import java.util.List;

/**
 * Outcome of a batch export.
 *
 * @param total number of pipelines in the batch
 * @param exported number of images handed to the sink
 * @param failedIndices indices of pipelines that failed, in order
 */
public record BatchExportSummary(int total, int exported, List<Integer> failedIndices) {

    public BatchExportSummary {
        failedIndices = List.copyOf(failedIndices);
    }

    public boolean isComplete() {
        return failedIndices.isEmpty() && exported == total;
    }
}
