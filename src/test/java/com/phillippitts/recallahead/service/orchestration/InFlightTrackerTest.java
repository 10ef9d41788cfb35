package com.phillippitts.recallahead.service.orchestration;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InFlightTrackerTest {

    private final InFlightTracker tracker = new InFlightTracker();

    @Test
    void startTracksQueryUntilFinished() {
        CancellationToken token = tracker.start("q");

        assertThat(tracker.isTracking("q")).isTrue();
        assertThat(tracker.query()).isEqualTo("q");

        tracker.finish();

        assertThat(tracker.isActive()).isFalse();
        assertThat(token.isCancellationRequested()).isFalse();
    }

    @Test
    void cancelActiveSignalsTokenAndClearsSlot() {
        CancellationToken token = tracker.start("q");

        assertThat(tracker.cancelActive()).isEqualTo("q");
        assertThat(token.isCancellationRequested()).isTrue();
        assertThat(tracker.isActive()).isFalse();
        assertThat(tracker.cancelActive()).isNull();
    }

    @Test
    void secondStartWithoutCancelIsRejected() {
        tracker.start("q");

        assertThatThrownBy(() -> tracker.start("r")).isInstanceOf(IllegalStateException.class);
    }
}
