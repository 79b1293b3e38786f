package com.phillippitts.tapguard.domain;

import java.util.Locale;

/**
 * Reason the reader reported for its last disconnect.
 *
 * <p>{@link #SECURITY_REBOOT} is the reboot marker: the reader restarts itself on a
 * fixed cadence and comes back without intervention, so recovery is held off for a
 * grace window after it.
 */
public enum DisconnectReason {
    SECURITY_REBOOT,
    CRITICALLY_LOW_BATTERY,
    POWERED_OFF,
    IDLE_POWER_DOWN,
    USB_DISCONNECTED,
    BLUETOOTH_DISCONNECTED,
    COMMAND_CANCELLED,
    UNKNOWN;

    /**
     * Lenient parse; unrecognised values map to {@link #UNKNOWN} because new reasons are
     * added by the reader vendor over time.
     */
    public static DisconnectReason fromWire(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (DisconnectReason reason : values()) {
            if (reason.name().equals(normalized)) {
                return reason;
            }
        }
        return UNKNOWN;
    }

    public boolean isRebootMarker() {
        return this == SECURITY_REBOOT;
    }
}
