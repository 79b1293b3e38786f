package com.phillippitts.tapguard.service.terminal;

import com.phillippitts.tapguard.domain.PaymentIntentRecord;
import com.phillippitts.tapguard.domain.PaymentIntentRequest;
import com.phillippitts.tapguard.exception.TerminalCommandException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CompletableFuture;

/**
 * Gateway used when no host integration provides reader or transaction commands.
 *
 * <p>Every command fails immediately so the engine records a failed attempt and keeps
 * backing off instead of waiting on a call that will never complete.
 */
public class UnboundTerminalGateway implements ReaderGateway, PaymentIntentGateway {

    private static final Logger LOG = LogManager.getLogger(UnboundTerminalGateway.class);

    public UnboundTerminalGateway() {
        LOG.warn("No terminal bridge gateway bound; recovery commands will fail until one is provided");
    }

    @Override
    public CompletableFuture<Void> cancelDiscovery() {
        return unbound("cancel-discovery");
    }

    @Override
    public CompletableFuture<Void> clearDiscoveredReaders() {
        return unbound("clear-discovered-devices");
    }

    @Override
    public CompletableFuture<Void> startDiscovery(String deviceTypeFilter, DiscoveryListener listener) {
        return unbound("start-discovery");
    }

    @Override
    public CompletableFuture<Void> connect(String readerId) {
        return unbound("connect");
    }

    @Override
    public CompletableFuture<Void> cancelPaymentCollection(String paymentIntentId) {
        return unbound("cancel-payment-collection");
    }

    @Override
    public CompletableFuture<Void> cancelPaymentIntent(String paymentIntentId) {
        return unbound("cancel-payment-intent");
    }

    @Override
    public CompletableFuture<PaymentIntentRecord> createPaymentIntent(PaymentIntentRequest request) {
        return unbound("create-payment-intent");
    }

    private static <T> CompletableFuture<T> unbound(String command) {
        return CompletableFuture.failedFuture(new TerminalCommandException(command, "no terminal bridge bound"));
    }
}
