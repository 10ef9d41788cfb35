package com.phillippitts.recallahead.service.trigger;

import com.phillippitts.recallahead.service.orchestration.QueryOrchestrator;
import com.phillippitts.recallahead.testutil.ManualEventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class InputTriggerGateTest {

    private final ManualEventLoop loop = new ManualEventLoop();
    private final InputTriggerPolicy policy = new InputTriggerPolicy(5, 2, 3);
    private QueryOrchestrator<?> orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = mock(QueryOrchestrator.class);
    }

    private InputTriggerGate gate(boolean heuristicEnabled) {
        return new InputTriggerGate(orchestrator, policy, heuristicEnabled, Duration.ofMillis(100), loop.clock());
    }

    @Test
    void forwardsTextAcceptedByPolicy() {
        InputTriggerGate gate = gate(true);

        assertThat(gate.offer("explain react hooks")).isTrue();

        verify(orchestrator).setText("explain react hooks");
    }

    @Test
    void dropsRepeatedTextWithinInterval() {
        InputTriggerGate gate = gate(true);
        gate.offer("explain react hooks");

        loop.advanceMillis(99);
        assertThat(gate.offer("explain react hooks")).isFalse();

        loop.advanceMillis(1);
        assertThat(gate.offer("explain react hooks")).isTrue();

        verify(orchestrator, times(2)).setText("explain react hooks");
    }

    @Test
    void differentTextWithinIntervalIsForwarded() {
        InputTriggerGate gate = gate(true);
        gate.offer("explain react hooks");

        assertThat(gate.offer("explain react hooks please")).isTrue();
    }

    @Test
    void dropsTextRejectedByPolicy() {
        InputTriggerGate gate = gate(true);

        assertThat(gate.offer("hello")).isFalse();

        verify(orchestrator, never()).setText(anyString());
    }

    @Test
    void disabledHeuristicForwardsEverything() {
        InputTriggerGate gate = gate(false);

        assertThat(gate.offer("hi")).isTrue();
        assertThat(gate.offer(null)).isTrue();

        verify(orchestrator).setText("hi");
        verify(orchestrator).setText("");
    }
}
