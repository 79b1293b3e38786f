package com.phillippitts.tapguard.service.recovery;

import java.util.Objects;

/**
 * Whether a cycle may proceed past the suppression gate.
 *
 * @param proceed {@code true} to continue with evaluation
 * @param reason  why the cycle was skipped, {@code null} when proceeding
 */
public record SuppressionDecision(boolean proceed, String reason) {

    public static final String SOFTWARE_UPDATE = "software-update-in-progress";
    public static final String REBOOT_GRACE = "security-reboot-grace";
    public static final String NOT_IN_PAYMENT_SESSION = "not-in-payment-session";

    private static final SuppressionDecision PROCEED = new SuppressionDecision(true, null);

    public SuppressionDecision {
        if (!proceed) {
            Objects.requireNonNull(reason, "reason");
        }
    }

    public static SuppressionDecision proceedWith() {
        return PROCEED;
    }

    public static SuppressionDecision skip(String reason) {
        return new SuppressionDecision(false, reason);
    }
}
