package com.phillippitts.tapguard.service.recovery.event;

import java.time.Instant;

/**
 * Published by the reboot grace timer when the suppression window after a reboot-class
 * disconnect has elapsed.
 *
 * @param rebootAt time of the disconnect that opened the window
 */
public record SuppressionWindowClosedEvent(Instant rebootAt, Instant at) {
}
