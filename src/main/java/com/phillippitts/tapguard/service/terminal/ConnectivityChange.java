package com.phillippitts.tapguard.service.terminal;

import com.phillippitts.tapguard.domain.Signal;

import java.time.Instant;
import java.util.Objects;

/**
 * Change of the SDK network signal between two known values.
 */
public record ConnectivityChange(Signal previous, Signal current, Instant at) {

    public ConnectivityChange {
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(at, "at");
    }

    public boolean wentOffline() {
        return previous.isTrue() && current.isFalse();
    }

    public boolean wentOnline() {
        return previous.isFalse() && current.isTrue();
    }

    public boolean isTransition() {
        return wentOffline() || wentOnline();
    }
}
