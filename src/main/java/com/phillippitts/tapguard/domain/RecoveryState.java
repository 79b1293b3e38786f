package com.phillippitts.tapguard.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Recovery bookkeeping carried from one cycle to the next.
 *
 * <p>Instances are immutable; the recovery cycle is the single writer and replaces the
 * current value after every decision. {@code recoveryType} is {@link RecoveryType#NONE}
 * (never {@code null}) while healthy, in which case both timestamps are {@code null}
 * and {@code attemptCount} is 0.
 */
public record RecoveryState(
        RecoveryType recoveryType,
        int attemptCount,
        Instant firstFailureTime,
        Instant lastAttemptTime
) {
    private static final RecoveryState HEALTHY = new RecoveryState(RecoveryType.NONE, 0, null, null);

    public RecoveryState {
        Objects.requireNonNull(recoveryType, "recoveryType");
        if (attemptCount < 0) {
            throw new IllegalArgumentException("attemptCount must be >= 0");
        }
    }

    public static RecoveryState healthy() {
        return HEALTHY;
    }

    /**
     * Fresh state for a newly detected failure type; no attempt made yet.
     */
    public static RecoveryState startingFor(RecoveryType type, Instant now) {
        if (!type.isFailure()) {
            return HEALTHY;
        }
        return new RecoveryState(type, 0, Objects.requireNonNull(now, "now"), null);
    }

    public boolean isRecovering() {
        return recoveryType.isFailure();
    }

    /**
     * State after one more executed attempt at {@code now}.
     */
    public RecoveryState withAttempt(Instant now) {
        if (!isRecovering()) {
            throw new IllegalStateException("No recovery in progress");
        }
        return new RecoveryState(recoveryType, attemptCount + 1, firstFailureTime, now);
    }

    public Duration elapsedSinceFirstFailure(Instant now) {
        if (firstFailureTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(firstFailureTime, now);
    }
}
