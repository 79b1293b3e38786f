package com.phillippitts.tapguard.service.recovery;

import java.util.Locale;

/**
 * What a recovery cycle ended up doing.
 */
public enum CycleAction {
    SUPPRESSED,
    HEALTHY,
    RECOVERED,
    ATTEMPT_SUCCEEDED,
    ATTEMPT_FAILED,
    PASSIVE_WAIT,
    BACKOFF_WAIT;

    public boolean isAttempt() {
        return this == ATTEMPT_SUCCEEDED || this == ATTEMPT_FAILED || this == PASSIVE_WAIT;
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
