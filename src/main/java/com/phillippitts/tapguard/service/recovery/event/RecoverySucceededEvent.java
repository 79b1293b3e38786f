package com.phillippitts.tapguard.service.recovery.event;

import com.phillippitts.tapguard.domain.RecoveryType;

import java.time.Duration;
import java.time.Instant;

/**
 * Published when classification returns to healthy after a failure.
 *
 * @param type         the failure type that cleared
 * @param attemptCount attempts made for that type
 * @param elapsed      time since the failure was first detected
 */
public record RecoverySucceededEvent(RecoveryType type, int attemptCount, Duration elapsed, Instant at) {
}
