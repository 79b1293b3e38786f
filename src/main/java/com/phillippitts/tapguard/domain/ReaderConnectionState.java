package com.phillippitts.tapguard.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Connection state of the card reader as reported by the transport bridge.
 */
public enum ReaderConnectionState {
    CONNECTED("connected"),
    CONNECTING("connecting"),
    DISCOVERING("discovering"),
    NOT_CONNECTED("not-connected"),
    UNKNOWN("unknown");

    private final String wireName;

    ReaderConnectionState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parses the bridge representation ({@code "not-connected"}, {@code "NOT_CONNECTED"} ...).
     *
     * @throws IllegalArgumentException for values outside the known set
     */
    @JsonCreator
    public static ReaderConnectionState fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ReaderConnectionState state : values()) {
            if (state.wireName.equals(normalized)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown reader connection state: " + value);
    }
}
