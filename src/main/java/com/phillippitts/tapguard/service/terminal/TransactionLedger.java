package com.phillippitts.tapguard.service.terminal;

import com.phillippitts.tapguard.domain.PaymentIntentRecord;

import java.util.Optional;

/**
 * Local record of the active transaction.
 */
public interface TransactionLedger {

    Optional<PaymentIntentRecord> current();

    void record(PaymentIntentRecord paymentIntent);

    /**
     * Clears the active transaction if it still has the given id.
     *
     * @return {@code true} if a record was removed
     */
    boolean clear(String paymentIntentId);
}
