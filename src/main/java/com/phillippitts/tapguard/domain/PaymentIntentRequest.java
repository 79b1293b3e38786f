package com.phillippitts.tapguard.domain;

import java.util.Objects;

/**
 * Parameters for create-payment-intent.
 *
 * @param amount          amount in minor currency units
 * @param currency        ISO currency code, lower case
 * @param category        merchant-configured category for zero-touch sales
 * @param offlineBehavior offline preference at creation time
 * @param autoCollect     start collecting a card immediately after creation
 */
public record PaymentIntentRequest(
        long amount,
        String currency,
        String category,
        OfflineBehavior offlineBehavior,
        boolean autoCollect
) {
    public PaymentIntentRequest {
        Objects.requireNonNull(currency, "currency");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(offlineBehavior, "offlineBehavior");
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
    }
}
