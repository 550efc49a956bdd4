package com.phillippitts.hdrcompute.service.events;

import com.phillippitts.hdrcompute.exception.ComputeTimeoutException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ErrorEventsListenerTest {

    @Test
    void throttlesRepeatLogs() {
        ErrorEventsListener l = new ErrorEventsListener();
        // first occurrence is logged
        assertThat(l.shouldLog("compute-edit-IOException")).isTrue();
        // immediate repeat is not
        assertThat(l.shouldLog("compute-edit-IOException")).isFalse();
        // other keys are throttled independently
        assertThat(l.shouldLog("compute-tiled-IOException")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        ErrorEventsListener l = new ErrorEventsListener();

        assertThatCode(() -> {
            l.onComputeFailed(new ComputeFailedEvent("tiled", Instant.now(), "tile failed",
                    new ComputeTimeoutException("tiled", 100), Map.of("grid", "2x2")));
            l.onComputeFailed(new ComputeFailedEvent("edit", Instant.now(), "no cause", null, null));
            l.onExportCompleted(new ExportCompletedEvent(640, 480, 4, 12, "job-1"));
        }).doesNotThrowAnyException();
    }

    @Test
    void failedEventDefaultsMessageAndContext() {
        ComputeFailedEvent event = new ComputeFailedEvent("edit", Instant.now(), null, null, null);

        assertThat(event.message()).isEmpty();
        assertThat(event.context()).isEmpty();
        assertThatThrownBy(() -> new ComputeFailedEvent("edit", null, "failed", null, null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void exportEventRejectsEmptyImage() {
        assertThatThrownBy(() -> new ExportCompletedEvent(0, 10, 1, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
