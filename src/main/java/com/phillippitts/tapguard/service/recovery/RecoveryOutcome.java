package com.phillippitts.tapguard.service.recovery;

import com.phillippitts.tapguard.domain.RecoveryType;

import java.util.Objects;

/**
 * Result of one executed recovery attempt. Failures are values, never exceptions.
 *
 * @param recreated whether the zero-touch transaction was replaced after a reconnect
 */
public record RecoveryOutcome(RecoveryType type, Result result, String detail, boolean recreated) {

    public enum Result {
        SUCCEEDED,
        FAILED,
        /** No action taken; waiting for the condition to clear by itself. */
        PASSIVE
    }

    public RecoveryOutcome {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(result, "result");
    }

    public static RecoveryOutcome succeeded(RecoveryType type, String detail, boolean recreated) {
        return new RecoveryOutcome(type, Result.SUCCEEDED, detail, recreated);
    }

    public static RecoveryOutcome failed(RecoveryType type, String detail) {
        return new RecoveryOutcome(type, Result.FAILED, detail, false);
    }

    public static RecoveryOutcome passive(RecoveryType type) {
        return new RecoveryOutcome(type, Result.PASSIVE, "waiting for network", false);
    }

    public boolean isSuccess() {
        return result == Result.SUCCEEDED;
    }
}
