package com.phillippitts.tapguard.service.recovery;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.phillippitts.tapguard.domain.RecoveryType;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Structured summary of one recovery cycle.
 *
 * @param classification  {@code null} when the cycle was suppressed before classification
 * @param attemptCount    attempts made for the active type after this cycle
 * @param elapsed         time since the active failure was first detected
 * @param skipReason      suppression reason, {@code null} unless suppressed
 * @param lifecycleAction transaction check that fired this cycle
 * @param detail          free-form outcome detail (failure message, remaining wait)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CycleReport(
        long cycleId,
        String trigger,
        Instant at,
        RecoveryType classification,
        CycleAction action,
        int attemptCount,
        Duration elapsed,
        String skipReason,
        LifecycleAction lifecycleAction,
        String detail
) {
    public CycleReport {
        Objects.requireNonNull(trigger, "trigger");
        Objects.requireNonNull(at, "at");
        Objects.requireNonNull(action, "action");
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
        lifecycleAction = lifecycleAction == null ? LifecycleAction.NONE : lifecycleAction;
    }
}
