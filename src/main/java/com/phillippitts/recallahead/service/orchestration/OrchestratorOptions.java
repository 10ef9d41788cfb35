package com.phillippitts.recallahead.service.orchestration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable tuning knobs of a {@link QueryOrchestrator}.
 *
 * @param minLength             shortest normalized query that may be searched
 * @param debounce              quiet period after the last keystroke before a lookup fires
 * @param cacheTtl              age after which a cached result is treated as absent
 * @param useCache              whether cached results are served at all
 * @param refreshOnCache        whether a cache hit is followed by a live lookup
 * @param nearDuplicateMaxDelta length tolerance of the near-duplicate heuristic
 */
public record OrchestratorOptions(
        int minLength,
        Duration debounce,
        Duration cacheTtl,
        boolean useCache,
        boolean refreshOnCache,
        int nearDuplicateMaxDelta
) {

    private static final Logger LOG = LogManager.getLogger(OrchestratorOptions.class);

    public static final int DEFAULT_MIN_LENGTH = 3;
    public static final Duration DEFAULT_DEBOUNCE = Duration.ofMillis(75);
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(60_000);
    public static final int DEFAULT_NEAR_DUPLICATE_MAX_DELTA = 1;

    /**
     * @throws IllegalArgumentException if a numeric option is negative
     * @throws NullPointerException if a duration is null
     */
    public OrchestratorOptions {
        Objects.requireNonNull(debounce, "debounce must not be null");
        Objects.requireNonNull(cacheTtl, "cacheTtl must not be null");
        if (minLength < 0) {
            throw new IllegalArgumentException("minLength must be >= 0, got: " + minLength);
        }
        if (debounce.isNegative()) {
            throw new IllegalArgumentException("debounce must not be negative, got: " + debounce);
        }
        if (cacheTtl.isNegative()) {
            throw new IllegalArgumentException("cacheTtl must not be negative, got: " + cacheTtl);
        }
        if (nearDuplicateMaxDelta < 0) {
            throw new IllegalArgumentException(
                    "nearDuplicateMaxDelta must be >= 0, got: " + nearDuplicateMaxDelta);
        }
    }

    public static OrchestratorOptions defaults() {
        return new OrchestratorOptions(DEFAULT_MIN_LENGTH, DEFAULT_DEBOUNCE, DEFAULT_CACHE_TTL,
                true, false, DEFAULT_NEAR_DUPLICATE_MAX_DELTA);
    }

    /**
     * Returns a copy with every non-null field of {@code update} applied. Negative numbers are
     * logged and ignored, leaving the current value in place.
     *
     * @param update partial update, may be null
     * @return merged options (this instance when nothing changes)
     */
    public OrchestratorOptions merge(OptionsUpdate update) {
        if (update == null) {
            return this;
        }
        int newMinLength = pickInt("minLength", update.minLength(), minLength);
        Duration newDebounce = pickMillis("debounceMs", update.debounceMs(), debounce);
        Duration newCacheTtl = pickMillis("cacheTtlMs", update.cacheTtlMs(), cacheTtl);
        boolean newUseCache = update.useCache() != null ? update.useCache() : useCache;
        boolean newRefresh = update.refreshOnCache() != null ? update.refreshOnCache() : refreshOnCache;
        int newDelta = pickInt("nearDuplicateMaxDelta", update.nearDuplicateMaxDelta(), nearDuplicateMaxDelta);

        OrchestratorOptions merged = new OrchestratorOptions(newMinLength, newDebounce, newCacheTtl,
                newUseCache, newRefresh, newDelta);
        return merged.equals(this) ? this : merged;
    }

    private static int pickInt(String name, Integer requested, int current) {
        if (requested == null) {
            return current;
        }
        if (requested < 0) {
            LOG.warn("Ignoring negative option {}={}", name, requested);
            return current;
        }
        return requested;
    }

    private static Duration pickMillis(String name, Long requested, Duration current) {
        if (requested == null) {
            return current;
        }
        if (requested < 0) {
            LOG.warn("Ignoring negative option {}={}", name, requested);
            return current;
        }
        return Duration.ofMillis(requested);
    }
}
