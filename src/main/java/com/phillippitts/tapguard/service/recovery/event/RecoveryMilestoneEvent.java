package com.phillippitts.tapguard.service.recovery.event;

import com.phillippitts.tapguard.domain.RecoveryType;

import java.time.Duration;
import java.time.Instant;

/**
 * Published every Nth attempt for the same recovery type.
 */
public record RecoveryMilestoneEvent(RecoveryType type, int attemptCount, Duration elapsed, Instant at) {
}
