package com.phillippitts.tapguard.domain;

/**
 * Closed set of conditions the recovery engine distinguishes.
 *
 * <p>Exactly one type is active per cycle; {@link #NONE} means healthy.
 */
public enum RecoveryType {
    READER_DISCONNECTED(BackoffClass.FAST),
    READER_NOT_READY(BackoffClass.FAST),
    READER_OFFLINE(BackoffClass.FAST),
    SDK_OFFLINE(BackoffClass.SLOW),
    TAP_TO_PAY_NOT_WAITING(BackoffClass.FAST),
    NONE(null);

    private final BackoffClass backoffClass;

    RecoveryType(BackoffClass backoffClass) {
        this.backoffClass = backoffClass;
    }

    /**
     * @return the backoff class, never {@code null} for failure types
     * @throws IllegalStateException for {@link #NONE}
     */
    public BackoffClass backoffClass() {
        if (backoffClass == null) {
            throw new IllegalStateException("NONE has no backoff class");
        }
        return backoffClass;
    }

    public boolean isFailure() {
        return this != NONE;
    }

    /**
     * Reader-related failures are remediated with the reconnect sequence.
     */
    public boolean requiresReconnect() {
        return backoffClass == BackoffClass.FAST;
    }
}
