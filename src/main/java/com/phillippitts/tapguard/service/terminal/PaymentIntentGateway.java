package com.phillippitts.tapguard.service.terminal;

import com.phillippitts.tapguard.domain.PaymentIntentRecord;
import com.phillippitts.tapguard.domain.PaymentIntentRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Transaction commands produced by the recovery engine.
 */
public interface PaymentIntentGateway {

    /**
     * Stops collecting a card for the given intent (leaves the awaiting-input sub-state).
     */
    CompletableFuture<Void> cancelPaymentCollection(String paymentIntentId);

    CompletableFuture<Void> cancelPaymentIntent(String paymentIntentId);

    CompletableFuture<PaymentIntentRecord> createPaymentIntent(PaymentIntentRequest request);
}
