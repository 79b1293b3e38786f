package com.phillippitts.tapguard.service.recovery;

import java.util.Locale;
import java.util.Objects;

/**
 * Result of a transaction cancel/recreate handled by {@link TransactionCoordinator}.
 */
public record LifecycleOutcome(LifecycleAction action, Status status, boolean recreated, String detail) {

    public enum Status {
        /** Nothing to do. */
        NOT_REQUIRED,
        APPLIED,
        FAILED,
        /** Another cancel/recreate was in flight; this request was dropped. */
        BUSY;

        public String tag() {
            return name().toLowerCase(Locale.ROOT).replace('_', '-');
        }
    }

    private static final LifecycleOutcome NOT_REQUIRED =
            new LifecycleOutcome(LifecycleAction.NONE, Status.NOT_REQUIRED, false, null);

    public LifecycleOutcome {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(status, "status");
    }

    public static LifecycleOutcome notRequired() {
        return NOT_REQUIRED;
    }

    public static LifecycleOutcome applied(LifecycleAction action, boolean recreated) {
        return new LifecycleOutcome(action, Status.APPLIED, recreated, null);
    }

    public static LifecycleOutcome failed(LifecycleAction action, String detail) {
        return new LifecycleOutcome(action, Status.FAILED, false, detail);
    }

    public static LifecycleOutcome busy(LifecycleAction action) {
        return new LifecycleOutcome(action, Status.BUSY, false, "transaction operation in flight");
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }
}
