package com.phillippitts.recallahead.config.properties;

import com.phillippitts.recallahead.service.orchestration.OrchestratorOptions;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the per-surface query orchestrators.
 *
 * <p>Unset values fall back to {@link OrchestratorOptions#defaults()}. The deployed values in
 * application.properties are tuned for a remote search API and are more conservative.
 */
@Validated
@ConfigurationProperties(prefix = "recall.orchestrator")
public class OrchestratorProperties {

    /** Shortest normalized query that is searched. */
    @Min(0)
    private final int minLength;

    /** Quiet period after the last keystroke (ms). */
    @Min(0)
    private final long debounceMs;

    /** Age after which cached results are discarded (ms). */
    @Min(0)
    private final long cacheTtlMs;

    private final boolean useCache;

    /** If true, a cache hit is shown and a live lookup still runs. */
    private final boolean refreshOnCache;

    /** Length tolerance for treating a prefix-extended query as a near duplicate. */
    @Min(0)
    private final int nearDuplicateMaxDelta;

    @ConstructorBinding
    public OrchestratorProperties(Integer minLength,
                                  Long debounceMs,
                                  Long cacheTtlMs,
                                  Boolean useCache,
                                  Boolean refreshOnCache,
                                  Integer nearDuplicateMaxDelta) {
        this.minLength = minLength == null ? OrchestratorOptions.DEFAULT_MIN_LENGTH : minLength;
        this.debounceMs = debounceMs == null ? OrchestratorOptions.DEFAULT_DEBOUNCE.toMillis() : debounceMs;
        this.cacheTtlMs = cacheTtlMs == null ? OrchestratorOptions.DEFAULT_CACHE_TTL.toMillis() : cacheTtlMs;
        this.useCache = useCache == null || useCache;
        this.refreshOnCache = refreshOnCache != null && refreshOnCache;
        this.nearDuplicateMaxDelta = nearDuplicateMaxDelta == null
                ? OrchestratorOptions.DEFAULT_NEAR_DUPLICATE_MAX_DELTA
                : nearDuplicateMaxDelta;
    }

    public int getMinLength() {
        return minLength;
    }

    public long getDebounceMs() {
        return debounceMs;
    }

    public long getCacheTtlMs() {
        return cacheTtlMs;
    }

    public boolean isUseCache() {
        return useCache;
    }

    public boolean isRefreshOnCache() {
        return refreshOnCache;
    }

    public int getNearDuplicateMaxDelta() {
        return nearDuplicateMaxDelta;
    }

    public OrchestratorOptions toOptions() {
        return new OrchestratorOptions(minLength, Duration.ofMillis(debounceMs), Duration.ofMillis(cacheTtlMs),
                useCache, refreshOnCache, nearDuplicateMaxDelta);
    }
}
