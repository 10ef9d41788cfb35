package com.phillippitts.recallahead.service.orchestration;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SequenceGuardTest {

    @Test
    void onlyLatestCapturedValueIsCurrent() {
        SequenceGuard guard = new SequenceGuard();

        long first = guard.next();
        long second = guard.next();

        assertThat(second).isGreaterThan(first);
        assertThat(guard.isCurrent(first)).isFalse();
        assertThat(guard.isCurrent(second)).isTrue();
        assertThat(guard.current()).isEqualTo(second);
    }
}
