package com.phillippitts.hdrcompute.service.edit;

/**
 * What {@link EditScheduler#requestCompute} did with a request.
 */
public enum RequestOutcome {
    /** A run was dispatched with this request. */
    DISPATCHED,
    /** A run is in progress; the value is applied by the next run. */
    QUEUED,
    /** The value equals the one already dispatched for the stage; nothing to do. */
    DROPPED
}
