package com.phillippitts.tapguard.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Last reader disconnect reported by the bridge.
 */
public record DisconnectRecord(DisconnectReason reason, Instant at) {

    public DisconnectRecord {
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(at, "at");
    }

    public boolean isRebootMarker() {
        return reason.isRebootMarker();
    }
}
