package com.phillippitts.tapguard.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Payment readiness of a connected reader.
 *
 * <p>{@link #AWAITING_INPUT} is the sub-state in which the reader waits for a card
 * presentation; zero-touch terminals are expected to sit in it permanently.
 */
public enum ReaderReadiness {
    READY("ready"),
    AWAITING_INPUT("awaiting-input"),
    PROCESSING("processing"),
    NOT_READY("not-ready"),
    UNKNOWN("unknown");

    private final String wireName;

    ReaderReadiness(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ReaderReadiness fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ReaderReadiness readiness : values()) {
            if (readiness.wireName.equals(normalized)) {
                return readiness;
            }
        }
        throw new IllegalArgumentException("Unknown reader readiness: " + value);
    }
}
