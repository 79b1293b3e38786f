package com.phillippitts.tapguard.domain;

/**
 * Three-valued reading of a boolean terminal signal.
 *
 * <p>{@link #UNKNOWN} is used when the signal was never reported or could not be read.
 * Classification only ever treats {@link #TRUE} as a positive reading, so an unknown
 * "online" signal counts as offline and an unknown "offline mode enabled" signal grants
 * no exemption.
 */
public enum Signal {
    TRUE,
    FALSE,
    UNKNOWN;

    /**
     * Maps a nullable boolean to a signal; {@code null} becomes {@link #UNKNOWN}.
     */
    public static Signal of(Boolean value) {
        if (value == null) {
            return UNKNOWN;
        }
        return value ? TRUE : FALSE;
    }

    public boolean isTrue() {
        return this == TRUE;
    }

    public boolean isFalse() {
        return this == FALSE;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
