package com.phillippitts.tapguard.service.recovery;

import com.phillippitts.tapguard.domain.PaymentIntentRecord;

import java.util.Objects;

/**
 * Outcome of inspecting the active transaction.
 *
 * @param action        matched check, {@link LifecycleAction#NONE} if none matched
 * @param paymentIntent transaction the action applies to, {@code null} for NONE
 * @param recreate      whether a replacement should be created after cancelling
 */
public record LifecycleVerdict(LifecycleAction action, PaymentIntentRecord paymentIntent, boolean recreate) {

    private static final LifecycleVerdict NONE = new LifecycleVerdict(LifecycleAction.NONE, null, false);

    public LifecycleVerdict {
        Objects.requireNonNull(action, "action");
        if (action != LifecycleAction.NONE) {
            Objects.requireNonNull(paymentIntent, "paymentIntent");
        }
    }

    public static LifecycleVerdict none() {
        return NONE;
    }

    public boolean requiresAction() {
        return action != LifecycleAction.NONE;
    }
}
