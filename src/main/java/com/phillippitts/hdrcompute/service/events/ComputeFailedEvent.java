package com.phillippitts.hdrcompute.service.events;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Published when a compute task fails: an interactive recompute, a tiled export or an
 * accelerated run.
 *
 * @param engine engine name (edit, tiled, accelerated)
 * @param timestamp when the failure was observed
 * @param message failure message
 * @param cause underlying exception
 * @param context additional context (session, stage ids, tile)
 */
public record ComputeFailedEvent(String engine, Instant timestamp, String message, Throwable cause,
                                 Map<String, String> context) {

    public ComputeFailedEvent {
        Objects.requireNonNull(engine, "engine must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        message = message == null ? "" : message;
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
