package com.phillippitts.recallahead.service.trigger;

import com.phillippitts.recallahead.service.orchestration.QueryOrchestrator;
import com.phillippitts.recallahead.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * First filter between raw input events of one surface and its orchestrator.
 *
 * <p>Drops an event whose text equals the last forwarded text when it arrives within
 * {@code minInterval} (editors often fire several input events per keystroke), then drops text
 * rejected by the {@link InputTriggerPolicy} unless the heuristic is disabled. Everything else
 * is forwarded to {@link QueryOrchestrator#setText(String)}.
 *
 * <p>Confined to the event loop, like the orchestrator it feeds.
 */
public final class InputTriggerGate {

    private static final Logger LOG = LogManager.getLogger(InputTriggerGate.class);

    private final QueryOrchestrator<?> orchestrator;
    private final InputTriggerPolicy policy;
    private final boolean heuristicEnabled;
    private final Duration minInterval;
    private final Clock clock;

    private String lastTriggeredText;
    private Instant lastTriggerTime = Instant.EPOCH;

    public InputTriggerGate(QueryOrchestrator<?> orchestrator,
                            InputTriggerPolicy policy,
                            boolean heuristicEnabled,
                            Duration minInterval,
                            Clock clock) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.heuristicEnabled = heuristicEnabled;
        this.minInterval = Objects.requireNonNull(minInterval, "minInterval must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param text raw text of the input field after the change
     * @return {@code true} if the text was forwarded to the orchestrator
     */
    public boolean offer(String text) {
        String value = text == null ? "" : text;
        Instant now = clock.instant();

        if (value.equals(lastTriggeredText)
                && Duration.between(lastTriggerTime, now).compareTo(minInterval) < 0) {
            LOG.trace("Dropping repeated input event {}", LogSanitizer.preview(value));
            return false;
        }
        if (heuristicEnabled && !policy.shouldTrigger(value)) {
            return false;
        }

        lastTriggeredText = value;
        lastTriggerTime = now;
        orchestrator.setText(value);
        return true;
    }
}
