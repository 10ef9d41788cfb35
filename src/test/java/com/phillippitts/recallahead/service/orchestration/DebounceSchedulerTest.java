package com.phillippitts.recallahead.service.orchestration;

import com.phillippitts.recallahead.testutil.ManualEventLoop;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DebounceSchedulerTest {

    private final ManualEventLoop loop = new ManualEventLoop();
    private final DebounceScheduler debounce = new DebounceScheduler(loop);
    private final List<String> fired = new ArrayList<>();

    @Test
    void onlyLastArmFires() {
        debounce.arm(() -> fired.add("a"), Duration.ofMillis(100));
        loop.advanceMillis(50);
        debounce.arm(() -> fired.add("b"), Duration.ofMillis(100));
        loop.advanceMillis(99);
        assertThat(fired).isEmpty();

        loop.advanceMillis(1);

        assertThat(fired).containsExactly("b");
        assertThat(debounce.isArmed()).isFalse();
    }

    @Test
    void disarmReportsWhetherTimerWasPending() {
        assertThat(debounce.disarm()).isFalse();
        debounce.arm(() -> fired.add("a"), Duration.ofMillis(100));

        assertThat(debounce.disarm()).isTrue();
        loop.advanceMillis(200);

        assertThat(fired).isEmpty();
    }
}
