package com.phillippitts.hdrcompute.service.edit;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulerStateTest {

    private final SchedulerState state = new SchedulerState();

    @Test
    void firstRequestTakesPermitAndDispatchesBatch() {
        SchedulerState.Admission admission = state.request("exposure", ev(1.0));

        assertThat(admission.outcome()).isEqualTo(RequestOutcome.DISPATCHED);
        assertThat(admission.batch()).containsExactly(Map.entry("exposure", ev(1.0)));
        assertThat(state.isRunInProgress()).isTrue();
        assertThat(state.isUpdatePending()).isFalse();
        assertThat(state.pendingCount()).isZero();
    }

    @Test
    void requestsWhileBusyAreQueuedWithLastWriteWins() {
        state.request("exposure", ev(1.0));

        assertThat(state.request("exposure", ev(2.0)).outcome()).isEqualTo(RequestOutcome.QUEUED);
        assertThat(state.request("exposure", ev(3.0)).outcome()).isEqualTo(RequestOutcome.QUEUED);
        assertThat(state.request("contrast", contrast(10)).outcome()).isEqualTo(RequestOutcome.QUEUED);

        assertThat(state.isUpdatePending()).isTrue();
        Map<String, Map<String, Object>> next = state.completeRun();
        assertThat(next).containsOnly(
                Map.entry("exposure", ev(3.0)),
                Map.entry("contrast", contrast(10)));
        assertThat(state.isRunInProgress()).isTrue();
        assertThat(state.isUpdatePending()).isFalse();
    }

    @Test
    void completingWithoutUpdatesReleasesPermit() {
        state.request("exposure", ev(1.0));

        assertThat(state.completeRun()).isNull();

        assertThat(state.isRunInProgress()).isFalse();
        assertThat(state.isUpdatePending()).isFalse();
    }

    @Test
    void identicalRequestIsDropped() {
        state.request("exposure", ev(1.0));

        assertThat(state.request("exposure", ev(1.0)).outcome()).isEqualTo(RequestOutcome.DROPPED);
        assertThat(state.isUpdatePending()).isFalse();

        state.completeRun();
        assertThat(state.request("exposure", ev(1.0)).outcome()).isEqualTo(RequestOutcome.DROPPED);
        assertThat(state.isRunInProgress()).isFalse();
    }

    @Test
    void returningToDispatchedValueCancelsPendingValue() {
        state.request("exposure", ev(1.0));
        state.request("exposure", ev(2.0));

        state.request("exposure", ev(1.0));

        assertThat(state.pendingValue("exposure")).isNull();
        assertThat(state.completeRun()).isNull();
        assertThat(state.isRunInProgress()).isFalse();
    }

    @Test
    void failedRunRestoresUnappliedValuesWithoutRetrying() {
        Map<String, Map<String, Object>> batch = state.request("exposure", ev(1.0)).batch();
        Map<String, Map<String, Object>> both = Map.of("exposure", ev(1.0), "contrast", contrast(5));

        // exposure reached the pipeline, contrast did not
        assertThat(state.failRun(both, List.of("exposure"))).isNull();

        assertThat(batch).containsKey("exposure");
        assertThat(state.isRunInProgress()).isFalse();
        assertThat(state.pendingValue("contrast")).isEqualTo(contrast(5));
        assertThat(state.pendingValue("exposure")).isNull();

        // the failed value no longer counts as dispatched
        SchedulerState.Admission retry = state.request("exposure", ev(1.0));
        assertThat(retry.outcome()).isEqualTo(RequestOutcome.DISPATCHED);
        assertThat(retry.batch()).containsOnlyKeys("exposure", "contrast");
    }

    @Test
    void failedRunKeepsNewerValuesAndDispatchesThem() {
        Map<String, Map<String, Object>> batch = state.request("exposure", ev(1.0)).batch();
        state.request("exposure", ev(3.0));

        Map<String, Map<String, Object>> next = state.failRun(batch, List.of());

        assertThat(next).containsExactly(Map.entry("exposure", ev(3.0)));
        assertThat(state.isRunInProgress()).isTrue();
    }

    @Test
    void exclusiveRunOnlyWhenIdle() {
        state.request("exposure", ev(1.0));
        assertThat(state.tryBeginExclusiveRun(() -> { })).isFalse();

        state.completeRun();
        boolean[] ran = new boolean[1];
        assertThat(state.tryBeginExclusiveRun(() -> ran[0] = true)).isTrue();

        assertThat(ran[0]).isTrue();
        assertThat(state.isRunInProgress()).isTrue();
        // dispatched values were forgotten
        assertThat(state.request("exposure", ev(1.0)).outcome()).isEqualTo(RequestOutcome.QUEUED);
    }

    @Test
    void awaitIdleWaitsForPermitRelease() throws InterruptedException {
        state.request("exposure", ev(1.0));

        assertThat(state.awaitIdle(Duration.ofMillis(20))).isFalse();

        state.completeRun();
        assertThat(state.awaitIdle(Duration.ofMillis(20))).isTrue();
    }

    private static Map<String, Object> ev(double value) {
        return Map.of("EV", value);
    }

    private static Map<String, Object> contrast(int value) {
        return Map.of("contrast", value);
    }
}
