package com.phillippitts.recallahead.service.orchestration;

/**
 * Partial update for {@link OrchestratorOptions}. A {@code null} field keeps the current value.
 *
 * <p>Doubles as the JSON body of {@code PATCH /api/surfaces/{id}/options}.
 */
public record OptionsUpdate(
        Integer minLength,
        Long debounceMs,
        Long cacheTtlMs,
        Boolean useCache,
        Boolean refreshOnCache,
        Integer nearDuplicateMaxDelta
) {

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder; unset fields stay {@code null}.
     */
    public static final class Builder {
        private Integer minLength;
        private Long debounceMs;
        private Long cacheTtlMs;
        private Boolean useCache;
        private Boolean refreshOnCache;
        private Integer nearDuplicateMaxDelta;

        private Builder() {
        }

        public Builder minLength(int minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder debounceMs(long debounceMs) {
            this.debounceMs = debounceMs;
            return this;
        }

        public Builder cacheTtlMs(long cacheTtlMs) {
            this.cacheTtlMs = cacheTtlMs;
            return this;
        }

        public Builder useCache(boolean useCache) {
            this.useCache = useCache;
            return this;
        }

        public Builder refreshOnCache(boolean refreshOnCache) {
            this.refreshOnCache = refreshOnCache;
            return this;
        }

        public Builder nearDuplicateMaxDelta(int nearDuplicateMaxDelta) {
            this.nearDuplicateMaxDelta = nearDuplicateMaxDelta;
            return this;
        }

        public OptionsUpdate build() {
            return new OptionsUpdate(minLength, debounceMs, cacheTtlMs, useCache, refreshOnCache,
                    nearDuplicateMaxDelta);
        }
    }
}
