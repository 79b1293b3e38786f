package com.phillippitts.tapguard.service.recovery.event;

import com.phillippitts.tapguard.service.recovery.LifecycleAction;
import com.phillippitts.tapguard.service.recovery.LifecycleOutcome;

import java.time.Instant;

/**
 * Published after every transaction cancel/recreate attempted outside the user's control.
 *
 * @param paymentIntentId masked identifier of the cancelled transaction, {@code null} if
 *                        only a creation was attempted
 */
public record LifecycleActionEvent(
        LifecycleAction action,
        LifecycleOutcome.Status status,
        String paymentIntentId,
        boolean recreated,
        String detail,
        Instant at
) {
    public LifecycleActionEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
