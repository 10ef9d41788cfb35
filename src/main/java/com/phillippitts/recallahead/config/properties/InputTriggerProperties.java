package com.phillippitts.recallahead.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the keystroke gate in front of each orchestrator.
 */
@Validated
@ConfigurationProperties(prefix = "recall.trigger")
public class InputTriggerProperties {

    /** If false, every keystroke reaches the orchestrator. */
    private final boolean heuristicEnabled;

    /** Identical text offered again within this window is dropped (ms). */
    @Min(0)
    private final long minIntervalMs;

    @Min(1)
    private final int minChars;

    @Min(1)
    private final int minWords;

    /** Word count that triggers a search when the text has no closing punctuation. */
    @Min(1)
    private final int minWordsWithoutPunctuation;

    @ConstructorBinding
    public InputTriggerProperties(Boolean heuristicEnabled,
                                  Long minIntervalMs,
                                  Integer minChars,
                                  Integer minWords,
                                  Integer minWordsWithoutPunctuation) {
        this.heuristicEnabled = heuristicEnabled == null || heuristicEnabled;
        this.minIntervalMs = minIntervalMs == null ? 100 : minIntervalMs;
        this.minChars = minChars == null ? 5 : minChars;
        this.minWords = minWords == null ? 2 : minWords;
        this.minWordsWithoutPunctuation = minWordsWithoutPunctuation == null ? 3 : minWordsWithoutPunctuation;
    }

    public boolean isHeuristicEnabled() {
        return heuristicEnabled;
    }

    public long getMinIntervalMs() {
        return minIntervalMs;
    }

    public int getMinChars() {
        return minChars;
    }

    public int getMinWords() {
        return minWords;
    }

    public int getMinWordsWithoutPunctuation() {
        return minWordsWithoutPunctuation;
    }
}
