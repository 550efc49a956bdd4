package com.phillippitts.hdrcompute.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for compute failure events. Throttled to avoid log spam while a user
 * drags a slider over a pipeline that keeps failing.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onComputeFailed(ComputeFailedEvent e) {
        String key = "compute-" + e.engine() + '-' + rootCauseName(e.cause());
        if (shouldLog(key)) {
            LOG.warn("Compute failed: engine={}, message={}, context={}", e.engine(), e.message(), e.context());
        }
    }

    @EventListener
    void onExportCompleted(ExportCompletedEvent e) {
        LOG.info("Export completed: {}x{} from {} tiles in {} ms", e.width(), e.height(), e.tiles(), e.durationMs());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }

    private static String rootCauseName(Throwable cause) {
        if (cause == null) {
            return "none";
        }
        Throwable root = cause;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getClass().getSimpleName();
    }
}
