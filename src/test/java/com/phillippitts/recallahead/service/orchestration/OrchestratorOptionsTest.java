package com.phillippitts.recallahead.service.orchestration;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrchestratorOptionsTest {

    @Test
    void defaults() {
        OrchestratorOptions options = OrchestratorOptions.defaults();

        assertThat(options.minLength()).isEqualTo(3);
        assertThat(options.debounce()).isEqualTo(Duration.ofMillis(75));
        assertThat(options.cacheTtl()).isEqualTo(Duration.ofMillis(60_000));
        assertThat(options.useCache()).isTrue();
        assertThat(options.refreshOnCache()).isFalse();
        assertThat(options.nearDuplicateMaxDelta()).isEqualTo(1);
    }

    @Test
    void mergeAppliesOnlyProvidedFields() {
        OrchestratorOptions merged = OrchestratorOptions.defaults().merge(OptionsUpdate.builder()
                .debounceMs(400)
                .refreshOnCache(true)
                .build());

        assertThat(merged.debounce()).isEqualTo(Duration.ofMillis(400));
        assertThat(merged.refreshOnCache()).isTrue();
        assertThat(merged.minLength()).isEqualTo(3);
        assertThat(merged.cacheTtl()).isEqualTo(Duration.ofMillis(60_000));
    }

    @Test
    void mergeIgnoresNegativesAndReturnsSameInstanceWhenUnchanged() {
        OrchestratorOptions defaults = OrchestratorOptions.defaults();

        assertThat(defaults.merge(new OptionsUpdate(-1, -1L, -1L, null, null, -1))).isSameAs(defaults);
        assertThat(defaults.merge(null)).isSameAs(defaults);
    }

    @Test
    void zeroValuesAreAccepted() {
        OrchestratorOptions merged = OrchestratorOptions.defaults().merge(OptionsUpdate.builder()
                .minLength(0).debounceMs(0).cacheTtlMs(0).nearDuplicateMaxDelta(0).build());

        assertThat(merged.debounce()).isZero();
        assertThat(merged.minLength()).isZero();
    }

    @Test
    void constructorRejectsInvalidValues() {
        assertThatThrownBy(() -> new OrchestratorOptions(-1, Duration.ZERO, Duration.ZERO, true, false, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OrchestratorOptions(1, Duration.ofMillis(-1), Duration.ZERO, true, false, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OrchestratorOptions(1, null, Duration.ZERO, true, false, 1))
                .isInstanceOf(NullPointerException.class);
    }
}
