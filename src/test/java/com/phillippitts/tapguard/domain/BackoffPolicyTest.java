package com.phillippitts.tapguard.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    private final BackoffPolicy fast = BackoffPolicy.ofSeconds(BackoffClass.FAST, List.of(30, 60, 120, 300));

    @Test
    void noWaitBeforeFirstAttempt() {
        assertThat(fast.requiredWaitAfter(0)).isEqualTo(Duration.ZERO);
    }

    @Test
    void lastEntryRepeatsAsCeiling() {
        assertThat(fast.requiredWaitAfter(4)).isEqualTo(Duration.ofSeconds(300));
        assertThat(fast.requiredWaitAfter(5)).isEqualTo(Duration.ofSeconds(300));
        assertThat(fast.requiredWaitAfter(1_000)).isEqualTo(fast.ceiling());
    }

    @Test
    void rejectsEmptyOrNonPositiveSchedules() {
        assertThatThrownBy(() -> BackoffPolicy.ofSeconds(BackoffClass.SLOW, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BackoffPolicy.ofSeconds(BackoffClass.SLOW, List.of(60, 0)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
