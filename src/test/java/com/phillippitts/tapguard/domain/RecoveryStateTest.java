package com.phillippitts.tapguard.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecoveryStateTest {

    private static final Instant T0 = Instant.parse("2026-03-02T08:00:00Z");

    @Test
    void healthyStateHasNoTimestamps() {
        RecoveryState healthy = RecoveryState.healthy();

        assertThat(healthy.recoveryType()).isEqualTo(RecoveryType.NONE);
        assertThat(healthy.attemptCount()).isZero();
        assertThat(healthy.firstFailureTime()).isNull();
        assertThat(healthy.lastAttemptTime()).isNull();
        assertThat(healthy.isRecovering()).isFalse();
    }

    @Test
    void attemptsKeepFirstFailureTime() {
        RecoveryState state = RecoveryState.startingFor(RecoveryType.READER_DISCONNECTED, T0)
                .withAttempt(T0)
                .withAttempt(T0.plusSeconds(30));

        assertThat(state.attemptCount()).isEqualTo(2);
        assertThat(state.firstFailureTime()).isEqualTo(T0);
        assertThat(state.lastAttemptTime()).isEqualTo(T0.plusSeconds(30));
        assertThat(state.elapsedSinceFirstFailure(T0.plusSeconds(90))).isEqualTo(Duration.ofSeconds(90));
    }

    @Test
    void cannotCountAttemptWhileHealthy() {
        assertThatThrownBy(() -> RecoveryState.healthy().withAttempt(T0))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void noneHasNoBackoffClass() {
        assertThat(RecoveryType.SDK_OFFLINE.backoffClass()).isEqualTo(BackoffClass.SLOW);
        assertThat(RecoveryType.TAP_TO_PAY_NOT_WAITING.backoffClass()).isEqualTo(BackoffClass.FAST);
        assertThatThrownBy(RecoveryType.NONE::backoffClass).isInstanceOf(IllegalStateException.class);
    }
}
