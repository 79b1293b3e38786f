package com.phillippitts.tapguard.domain;

/**
 * Retry-interval family for a recovery type.
 *
 * <p>{@link #FAST} covers hardware reconnection failures, {@link #SLOW} covers network
 * outages the terminal cannot fix by itself.
 */
public enum BackoffClass {
    FAST,
    SLOW
}
